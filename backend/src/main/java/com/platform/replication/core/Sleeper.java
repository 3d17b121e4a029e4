package com.platform.replication.core;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts. Must honour thread interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
