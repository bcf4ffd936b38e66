package com.libragraph.workqueue.core.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a {@link WorkItem}.
 * <p>
 * Allowed edges: {@code PENDING -> PROCESSING} (claim),
 * {@code PROCESSING -> COMPLETED | FAILED} (terminal write) and
 * {@code PROCESSING -> PENDING} (reclaim). Terminal states have no exits.
 */
public enum WorkItemStatus {
    PENDING(0, "pending"),
    PROCESSING(1, "processing"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    WorkItemStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(WorkItemStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED || next == PENDING;
            case COMPLETED, FAILED -> false;
        };
    }

    public static WorkItemStatus fromId(int id) {
        for (WorkItemStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown WorkItemStatus id: " + id);
    }

    @JsonCreator
    public static WorkItemStatus fromLabel(String label) {
        for (WorkItemStatus s : values()) {
            if (s.label.equalsIgnoreCase(label) || s.name().equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown WorkItemStatus: " + label);
    }
}
