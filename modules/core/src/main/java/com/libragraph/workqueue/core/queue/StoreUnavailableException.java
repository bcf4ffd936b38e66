package com.libragraph.workqueue.core.queue;

/**
 * Transient infrastructure failure of the work item store. Callers retry with
 * backoff; it never means "no work".
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }
}
