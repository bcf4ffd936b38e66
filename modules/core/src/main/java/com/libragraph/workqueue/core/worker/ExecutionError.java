package com.libragraph.workqueue.core.worker;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Failure detail recorded on a {@code failed} work item.
 *
 * @param message       human-readable detail, stored in {@code error}
 * @param exceptionType class name of the cause, when the failure was an exception
 * @param category      coarse class used for alerting, stored in {@code error_category}
 */
public record ExecutionError(
        String message,
        String exceptionType,
        String category
) {
    public static final String QUOTA_EXCEEDED = "quota_exceeded";
    public static final String API_KEY_INVALID = "api_key_invalid";
    public static final String STORAGE_ERROR = "storage_error";
    public static final String TIMEOUT = "timeout";
    public static final String NETWORK_ERROR = "network_error";
    public static final String RESOURCE_ERROR = "resource_error";
    public static final String UNKNOWN_ERROR = "unknown_error";

    public static final String UNKNOWN_MESSAGE = "Unknown error";

    private static final Set<String> CRITICAL = Set.of(QUOTA_EXCEEDED, API_KEY_INVALID, STORAGE_ERROR);

    public static ExecutionError of(String message) {
        if (message == null || message.isBlank()) {
            return new ExecutionError(UNKNOWN_MESSAGE, null, UNKNOWN_ERROR);
        }
        return new ExecutionError(message, null, categorize(message));
    }

    public static ExecutionError from(Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        String category;
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
            category = TIMEOUT;
        } else if (t instanceof ConnectException || t instanceof UnknownHostException) {
            category = NETWORK_ERROR;
        } else if (t instanceof OutOfMemoryError) {
            category = RESOURCE_ERROR;
        } else {
            category = categorize(message);
        }
        return new ExecutionError(message, t.getClass().getName(), category);
    }

    public static ExecutionError timedOut(Duration limit) {
        return new ExecutionError("Execution exceeded time limit of " + limit,
                TimeoutException.class.getName(), TIMEOUT);
    }

    /** Keyword classification of a failure message; first match wins. */
    static String categorize(String message) {
        if (message == null) return UNKNOWN_ERROR;
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("quota") || m.contains("rate limit")) return QUOTA_EXCEEDED;
        if (m.contains("api key") || m.contains("authentication")) return API_KEY_INVALID;
        if (m.contains("storage") || m.contains("bucket")) return STORAGE_ERROR;
        if (m.contains("timeout") || m.contains("timed out")) return TIMEOUT;
        if (m.contains("network") || m.contains("connection")) return NETWORK_ERROR;
        if (m.contains("memory") || m.contains("resource")) return RESOURCE_ERROR;
        return UNKNOWN_ERROR;
    }

    /** Categories that need operator attention rather than a resubmit. */
    public boolean critical() {
        return isCritical(category);
    }

    public static boolean isCritical(String category) {
        return category != null && CRITICAL.contains(category);
    }
}
