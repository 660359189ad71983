package com.flagship.general_ledger.observability;

import java.util.UUID;

/**
 * Thread-local holder of the request correlation ID.
 *
 * The same ID is put in the MDC for log lines and copied into every audit
 * record written during the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String PERIOD_ID_MDC_KEY = "periodId";
    public static final String RECONCILIATION_ID_MDC_KEY = "reconciliationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, generating one for threads outside a request
     * (schedulers, tests).
     */
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

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
