package com.libragraph.workqueue.core.queue;

/**
 * Thrown when an update targets a work item that does not exist.
 */
public class WorkItemNotFoundException extends RuntimeException {

    private final long itemId;

    public WorkItemNotFoundException(long itemId) {
        super("Work item not found: " + itemId);
        this.itemId = itemId;
    }

    public long itemId() {
        return itemId;
    }
}
