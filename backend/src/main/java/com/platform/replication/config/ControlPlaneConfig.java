package com.platform.replication.config;

import com.platform.replication.translation.TranslationEngine;
import com.platform.replication.translation.TranslationTables;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans that are not components themselves.
 */
@Configuration
public class ControlPlaneConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Translation engine over the built-in tables. A defective table fails startup.
     */
    @Bean
    public TranslationEngine translationEngine() {
        TranslationEngine engine = new TranslationEngine(TranslationTables.all());
        engine.validateAll();
        return engine;
    }
}
