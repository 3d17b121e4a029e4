package com.platform.replication.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids for HTTP requests and MDC keys for reconciles.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_INTENT = "intent";
    public static final String MDC_BACKEND = "backend";

    @Value("${spring.application.name:replication-control-plane}")
    private String applicationName;

    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }

    /**
     * Put the reconcile context of one intent into MDC.
     */
    public static void setReconcileContext(String requestId, String intent) {
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_INTENT, intent);
    }

    public static void setBackendContext(String backend) {
        MDC.put(MDC_BACKEND, backend);
    }

    public static void clearReconcileContext() {
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_INTENT);
        MDC.remove(MDC_BACKEND);
    }
}
