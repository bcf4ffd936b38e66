package com.libragraph.workqueue.core.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.libragraph.workqueue.core.queue.WorkItem;

import java.time.Instant;

/** Body of the completion callback. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionNotification(
        long id,
        String status,
        @JsonRawValue String result,
        String error,
        String errorCategory,
        String workerId,
        Instant timestamp
) {
    public static CompletionNotification of(WorkItem item, String workerId) {
        Instant at = item.finishedAt() != null ? item.finishedAt() : Instant.now();
        return new CompletionNotification(item.id(), item.status().label(), item.result(),
                item.error(), item.errorCategory(), workerId, at);
    }
}
