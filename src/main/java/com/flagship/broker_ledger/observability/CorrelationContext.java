package com.flagship.broker_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and MDC keys shared by every log line of a request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String SETTLEMENT_ID_MDC_KEY = "settlementId";

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
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags the current thread's log lines with the account being mutated.
     * Returns a handle that removes the tag again.
     */
    public static MDC.MDCCloseable forAccount(UUID accountId) {
        return MDC.putCloseable(ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));
    }

    public static void putSettlementId(UUID settlementId) {
        MDC.put(SETTLEMENT_ID_MDC_KEY, String.valueOf(settlementId));
    }

    public static void clearSettlementId() {
        MDC.remove(SETTLEMENT_ID_MDC_KEY);
    }
}
