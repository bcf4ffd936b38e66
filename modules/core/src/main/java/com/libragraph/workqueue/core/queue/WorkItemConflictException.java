package com.libragraph.workqueue.core.queue;

/**
 * Thrown when a conditional update's precondition no longer holds: the item has a
 * different status, owner or claim generation than the caller expected.
 */
public class WorkItemConflictException extends RuntimeException {

    private final long itemId;
    private final WorkItemStatus expectedStatus;
    private final WorkItemStatus actualStatus;
    private final String actualOwner;

    public WorkItemConflictException(long itemId, WorkItemStatus expectedStatus,
                                     WorkItemStatus actualStatus, String actualOwner) {
        super("Work item " + itemId + " conflict: expected " + expectedStatus
                + " but was " + actualStatus
                + (actualOwner != null ? " (owner=" + actualOwner + ")" : ""));
        this.itemId = itemId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = actualStatus;
        this.actualOwner = actualOwner;
    }

    public long itemId() {
        return itemId;
    }

    public WorkItemStatus expectedStatus() {
        return expectedStatus;
    }

    public WorkItemStatus actualStatus() {
        return actualStatus;
    }

    public String actualOwner() {
        return actualOwner;
    }
}
