package com.libragraph.workqueue.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.workqueue.core.db.DatabaseService;
import com.libragraph.workqueue.core.event.WorkItemEvents;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import com.libragraph.workqueue.core.service.AbstractManagedService;
import com.libragraph.workqueue.core.service.DependsOn;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs this process's {@link WorkerLoop}s, each on its own thread.
 * <p>
 * Loops only start when {@code workqueue.worker.enabled} is set and the application
 * provides a {@link WorkExecutor} bean.
 */
@ApplicationScoped
@Startup
@DependsOn(DatabaseService.class)
public class WorkerService extends AbstractManagedService {

    private static final Duration STOP_GRACE = Duration.ofSeconds(10);

    @Inject
    DatabaseService databaseService;

    @Inject
    WorkItemStore store;

    @Inject
    Instance<WorkExecutor> executors;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    WorkItemEvents events;

    @ConfigProperty(name = "workqueue.worker.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "workqueue.worker.id")
    Optional<String> configuredWorkerId;

    @ConfigProperty(name = "workqueue.worker.count", defaultValue = "1")
    int workerCount;

    @ConfigProperty(name = "workqueue.worker.poll-interval", defaultValue = "10s")
    Duration pollInterval;

    @ConfigProperty(name = "workqueue.worker.backoff-initial", defaultValue = "1s")
    Duration backoffInitial;

    @ConfigProperty(name = "workqueue.worker.backoff-max", defaultValue = "30s")
    Duration backoffMax;

    @ConfigProperty(name = "workqueue.worker.execution-timeout", defaultValue = "1h")
    Duration executionTimeout;

    private final List<WorkerLoop> loops = Collections.synchronizedList(new ArrayList<>());
    private final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String serviceId() {
        return "worker-pool";
    }

    @Override
    protected void doStart() {
        if (!enabled) {
            log.info("Worker loops disabled (workqueue.worker.enabled=false)");
            return;
        }
        if (!executors.isResolvable()) {
            log.warn("No unique WorkExecutor bean available; worker loops not started");
            return;
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workqueue.worker.count must be at least 1: " + workerCount);
        }

        WorkExecutor executor = executors.get();
        WorkerSettings settings = new WorkerSettings(pollInterval, backoffInitial, backoffMax, executionTimeout);
        String baseId = baseWorkerId();

        for (int i = 0; i < workerCount; i++) {
            String workerId = workerCount == 1 ? baseId : baseId + "-" + i;
            WorkerLoop loop = new WorkerLoop(workerId, store, executor, objectMapper, settings, events::finished);
            Thread thread = new Thread(loop, "work-worker-" + i);
            loops.add(loop);
            threads.add(thread);
            thread.start();
        }

        log.infof("Worker pool started with %d worker(s), base id %s", workerCount, baseId);
    }

    @Override
    protected void doStop() throws InterruptedException {
        synchronized (loops) {
            loops.forEach(WorkerLoop::stop);
        }
        synchronized (threads) {
            for (Thread t : threads) {
                t.join(STOP_GRACE.toMillis());
                if (t.isAlive()) {
                    // still executing: interrupt and leave the item to the reclaimer
                    log.warnf("Worker thread %s did not stop within %s, interrupting", t.getName(), STOP_GRACE);
                    t.interrupt();
                }
            }
        }
        loops.clear();
        threads.clear();
        log.info("Worker pool stopped");
    }

    public List<WorkerLoop> loops() {
        synchronized (loops) {
            return List.copyOf(loops);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    String baseWorkerId() {
        return configuredWorkerId
                .filter(s -> !s.isBlank())
                .orElseGet(() -> "worker-" + ProcessHandle.current().pid());
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("WorkerService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping WorkerService", e);
        }
    }
}
