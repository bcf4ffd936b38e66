package com.libragraph.workqueue.core.event;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for async CDI events, so that slow observers (the completion callback)
 * never run on a worker thread.
 */
@ApplicationScoped
public class EventExecutorProducer {

    @ConfigProperty(name = "workqueue.events.threads", defaultValue = "2")
    int threads;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("eventExecutor")
    public ExecutorService eventExecutor() {
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "workqueue-event-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
