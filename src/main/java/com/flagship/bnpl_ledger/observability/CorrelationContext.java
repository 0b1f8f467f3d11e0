package com.flagship.bnpl_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used by ledger services.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header (or is generated),
 * appears in every log line, and is copied onto outbox events and their Kafka headers.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CUSTOMER_ID_MDC_KEY = "customerId";
    public static final String MERCHANT_ID_MDC_KEY = "merchantId";
    public static final String REQUEST_ID_MDC_KEY = "purchaseRequestId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String SETTLEMENT_ID_MDC_KEY = "settlementId";

    private static final String[] ENTITY_KEYS = {
        CUSTOMER_ID_MDC_KEY, MERCHANT_ID_MDC_KEY, REQUEST_ID_MDC_KEY, TRANSACTION_ID_MDC_KEY, SETTLEMENT_ID_MDC_KEY
    };

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
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

    /**
     * Starts a unit of work (an HTTP request, a consumed message, a sweep) under the given
     * correlation id, or a fresh one when it is blank, and puts it in the MDC.
     *
     * @return the id in effect
     */
    public static String begin(String incomingId) {
        String id = incomingId == null || incomingId.isBlank() ? generateCorrelationId() : incomingId;
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Ends the unit of work started by {@link #begin(String)}. Pooled threads carry nothing over.
     */
    public static void end() {
        clear();
        clearEntities();
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts an entity id into the MDC for the rest of the operation.
     */
    public static void putEntity(String key, UUID id) {
        if (id != null) {
            MDC.put(key, id.toString());
        }
    }

    public static void clearEntities() {
        for (String key : ENTITY_KEYS) {
            MDC.remove(key);
        }
    }
}
