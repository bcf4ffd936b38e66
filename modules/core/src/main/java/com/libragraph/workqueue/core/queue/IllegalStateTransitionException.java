package com.libragraph.workqueue.core.queue;

/**
 * Thrown for status changes the lifecycle does not allow, before any write is attempted.
 */
public class IllegalStateTransitionException extends RuntimeException {

    private final WorkItemStatus from;
    private final WorkItemStatus to;

    public IllegalStateTransitionException(WorkItemStatus from, WorkItemStatus to, String reason) {
        super("Illegal transition " + from + " -> " + to + ": " + reason);
        this.from = from;
        this.to = to;
    }

    public WorkItemStatus from() {
        return from;
    }

    public WorkItemStatus to() {
        return to;
    }
}
