package com.flagship.live_event_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation ID plus the MDC keys used across the service.
 *
 * The correlation ID enters from the {@code X-Correlation-ID} header (or is
 * generated), is attached to every log line and travels with realtime
 * broadcasts so a websocket fan-out can be traced back to its request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, generating one for threads that did
     * not come through the HTTP filter.
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

    /**
     * Puts event and user IDs into the MDC for the duration of an operation.
     * Pair with {@link #clearOperation()} in a finally block.
     */
    public static void putOperation(UUID eventId, UUID userId) {
        if (eventId != null) {
            MDC.put(EVENT_ID_MDC_KEY, eventId.toString());
        }
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId.toString());
        }
    }

    public static void clearOperation() {
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}
