package com.flagship.token_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys attached to every log line of a ledger request.
 *
 * The correlation ID and caller are bound per HTTP request by
 * {@link CorrelationIdFilter}; the transaction index is bound by the service
 * once a write commits.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_HEADER = "X-Caller";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TX_INDEX_MDC_KEY = "txIndex";
    public static final String CALLER_MDC_KEY = "caller";

    private CorrelationContext() {
    }

    /**
     * Uses the ID supplied by the client, or a fresh short one if it sent none.
     */
    public static String resolveCorrelationId(String supplied) {
        if (supplied != null && !supplied.isBlank()) {
            return supplied;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void bindRequest(String correlationId, String caller) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        if (caller != null && !caller.isBlank()) {
            MDC.put(CALLER_MDC_KEY, caller);
        }
    }

    public static void bindTxIndex(long index) {
        MDC.put(TX_INDEX_MDC_KEY, Long.toString(index));
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CALLER_MDC_KEY);
        MDC.remove(TX_INDEX_MDC_KEY);
    }
}
