package com.libragraph.workqueue.core.event;

import com.libragraph.workqueue.core.queue.WorkItem;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.NotificationOptions;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import java.util.concurrent.ExecutorService;

/** Publishes {@link WorkItemFinishedEvent}s on the event executor, for every terminal-write path. */
@ApplicationScoped
public class WorkItemEvents {

    @Inject
    Event<WorkItemFinishedEvent> finishedEvent;

    @Inject
    @Named("eventExecutor")
    ExecutorService eventExecutor;

    public void finished(WorkItem item, String workerId) {
        finishedEvent.fireAsync(new WorkItemFinishedEvent(item, workerId),
                NotificationOptions.ofExecutor(eventExecutor));
    }
}
