package com.flagship.lending_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation ID plus the MDC keys lending code logs under.
 *
 * HTTP requests get their ID from {@link CorrelationIdFilter}; scheduled jobs open a
 * fresh one per run with {@link #startJob(String)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LOAN_ID_MDC_KEY = "loanId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Starts a correlation scope for one run of a background job, prefixed with the job name.
     */
    public static String startJob(String jobName) {
        String id = jobName + "-" + generateCorrelationId();
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(LOAN_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
