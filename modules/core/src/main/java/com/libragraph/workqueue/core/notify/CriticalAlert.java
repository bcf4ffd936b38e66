package com.libragraph.workqueue.core.notify;

import com.libragraph.workqueue.core.queue.WorkItem;

import java.time.Instant;

/** Pushed when an item fails with a category that needs operator attention. */
public record CriticalAlert(
        String type,
        long id,
        String errorCategory,
        String error,
        String workerId,
        Instant timestamp
) {
    public static final String TYPE = "critical_error";

    public static CriticalAlert of(WorkItem item, String workerId) {
        Instant at = item.finishedAt() != null ? item.finishedAt() : Instant.now();
        return new CriticalAlert(TYPE, item.id(), item.errorCategory(), item.error(), workerId, at);
    }
}
