package com.bondplatform.common.trace;

import org.slf4j.MDC;

/**
 * Puts the relay message id on log lines.
 *
 * <p>MDC is only written as a temporary bridge around a log statement, never kept as
 * a ThreadLocal store: relay callbacks run on whatever thread the HTTP client picks.
 */
public final class TraceContextUtil {

    public static final String MESSAGE_ID_KEY = "messageId";

    private TraceContextUtil() {}

    /**
     * Bridges {@code messageId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String messageId, Runnable logAction) {
        MDC.put(MESSAGE_ID_KEY, messageId);
        try {
            logAction.run();
        } finally {
            MDC.remove(MESSAGE_ID_KEY);
        }
    }
}
