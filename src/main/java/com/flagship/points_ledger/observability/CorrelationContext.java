package com.flagship.points_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by the log pattern, plus helpers to set them for a unit of
 * work.
 *
 * The worker opens a scope per job, the withdraw flow per account. Every log
 * statement inside the scope carries the ids without passing them around.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String JOB_ID_MDC_KEY = "jobId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Puts a key into the MDC until the returned scope is closed, restoring
     * whatever value was there before.
     */
    public static Scope with(String key, Object value) {
        String previous = MDC.get(key);
        MDC.put(key, String.valueOf(value));
        return () -> {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        };
    }

    /**
     * Opens a correlation scope, generating an id if none is active.
     */
    public static Scope ensureCorrelationId() {
        String existing = MDC.get(CORRELATION_ID_MDC_KEY);
        if (existing != null && !existing.isBlank()) {
            return () -> { };
        }
        return with(CORRELATION_ID_MDC_KEY, generateCorrelationId());
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * An MDC entry that is removed on close.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
