package com.flagship.account_service.observability;

import org.slf4j.MDC;

/**
 * MDC keys carried by every log line of a request.
 *
 * correlationId lives for the whole request and is owned by {@link RequestLoggingFilter}.
 * accountId is set around a single account operation and cleared when it ends.
 */
public final class LogContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String ACCOUNT_ID_KEY = "accountId";

    private LogContext() {
    }

    /**
     * @return the correlation id of the request being served, or null outside a filtered request
     */
    public static String correlationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public static void putAccountId(long accountId) {
        MDC.put(ACCOUNT_ID_KEY, Long.toString(accountId));
    }

    public static void clearAccountId() {
        MDC.remove(ACCOUNT_ID_KEY);
    }
}
