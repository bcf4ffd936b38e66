package com.libragraph.workqueue.core.event;

import com.libragraph.workqueue.core.queue.WorkItem;

/**
 * Fired asynchronously after a worker's terminal write succeeded.
 *
 * @param item     the item as written ({@code completed} or {@code failed})
 * @param workerId the worker that executed it
 */
public record WorkItemFinishedEvent(WorkItem item, String workerId) {}
