package com.libragraph.workqueue.core.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.workqueue.core.queue.StoreUnavailableException;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemConflictException;
import com.libragraph.workqueue.core.queue.WorkItemNotFoundException;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One worker: claims a single item, executes it, writes back the outcome, repeats.
 *
 * <p>Ownership lives in the store ({@code owner} + {@code status}); the loop holds no
 * lock while executing. Terminal writes are conditional on the owner and claim
 * generation this loop received, so a result from an execution that was reclaimed
 * meanwhile is discarded, never forced.
 *
 * <p>There is no crash cleanup. If the process dies mid-execution the item stays
 * {@code processing} until the reclaimer returns it to the pool.
 */
public class WorkerLoop implements Runnable, AutoCloseable {

    public enum Phase { IDLE, CLAIMING, EXECUTING, REPORTING }

    public enum IterationResult { EMPTY, COMPLETED, FAILED, LOST_RACE, STORE_UNAVAILABLE }

    /** Receives each item after its terminal write succeeded. */
    @FunctionalInterface
    public interface FinishListener {
        void onFinished(WorkItem item, String workerId);
    }

    private static final Logger log = Logger.getLogger(WorkerLoop.class);

    private final String workerId;
    private final WorkItemStore store;
    private final WorkExecutor executor;
    private final ObjectMapper objectMapper;
    private final WorkerSettings settings;
    private final FinishListener listener;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private ExecutorService executionThread;
    private volatile Phase phase = Phase.IDLE;
    private volatile boolean running;
    private volatile Instant lastPoll;

    public WorkerLoop(String workerId, WorkItemStore store, WorkExecutor executor,
                      ObjectMapper objectMapper, WorkerSettings settings, FinishListener listener) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
        this.store = store;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.listener = listener;
    }

    public String workerId() {
        return workerId;
    }

    public Phase phase() {
        return phase;
    }

    public boolean isRunning() {
        return running;
    }

    /** Start of the most recent claim attempt, or null before the first one. */
    public Instant lastPoll() {
        return lastPoll;
    }

    @Override
    public void run() {
        running = true;
        log.infof("Worker %s started (poll=%s, timeout=%s)",
                workerId, settings.pollInterval(), settings.executionTimeout());
        int storeFailures = 0;
        try {
            while (running) {
                try {
                    IterationResult result = runOnce();
                    switch (result) {
                        case EMPTY -> {
                            storeFailures = 0;
                            pause(settings.pollInterval());
                        }
                        case STORE_UNAVAILABLE -> {
                            storeFailures++;
                            Duration backoff = settings.backoff(storeFailures);
                            log.warnf("Worker %s: store unavailable, retrying in %s (attempt %d)",
                                    workerId, backoff, storeFailures);
                            pause(backoff);
                        }
                        default -> storeFailures = 0;
                    }
                } catch (RuntimeException e) {
                    log.errorf(e, "Worker %s: unexpected error in worker loop", workerId);
                    pause(settings.backoff(1));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            phase = Phase.IDLE;
            close();
            log.infof("Worker %s stopped", workerId);
        }
    }

    /** Asks {@link #run()} to exit after the current iteration. */
    public void stop() {
        running = false;
        stopSignal.countDown();
    }

    /** Releases the execution thread; {@link #run()} does this on exit. */
    @Override
    public synchronized void close() {
        if (executionThread != null) {
            executionThread.shutdownNow();
            executionThread = null;
        }
    }

    /**
     * One claim / execute / report cycle.
     *
     * @throws InterruptedException if the loop thread is interrupted while waiting on
     *                              the execution; the item is left to the reclaimer
     */
    public IterationResult runOnce() throws InterruptedException {
        phase = Phase.CLAIMING;
        lastPoll = Instant.now();

        Optional<WorkItem> claimed;
        try {
            claimed = store.claimNext(workerId);
        } catch (StoreUnavailableException e) {
            phase = Phase.IDLE;
            log.warnf("Worker %s: claim failed: %s", workerId, e.getMessage());
            return IterationResult.STORE_UNAVAILABLE;
        }

        if (claimed.isEmpty()) {
            phase = Phase.IDLE;
            return IterationResult.EMPTY;
        }

        WorkItem item = claimed.get();
        log.infof("Worker %s claimed work item %d (generation %d)", workerId, item.id(), item.claimGeneration());

        try {
            phase = Phase.EXECUTING;
            WorkOutcome outcome = execute(item);

            phase = Phase.REPORTING;
            return report(item, outcome);
        } catch (StoreUnavailableException e) {
            log.warnf("Worker %s: outcome of work item %d not recorded (%s); it stays processing until reclaimed",
                    workerId, item.id(), e.getMessage());
            return IterationResult.STORE_UNAVAILABLE;
        } finally {
            phase = Phase.IDLE;
        }
    }

    private WorkOutcome execute(WorkItem item) throws InterruptedException {
        Future<WorkOutcome> future = executionThread().submit(() -> executor.execute(item));
        Duration limit = settings.executionTimeout();
        try {
            WorkOutcome outcome = limit.isZero()
                    ? future.get()
                    : future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : WorkOutcome.completed(null);
        } catch (TimeoutException e) {
            future.cancel(true);
            // the interrupted execution may ignore the interrupt; never queue behind it
            close();
            log.warnf("Worker %s: work item %d exceeded execution timeout %s", workerId, item.id(), limit);
            return WorkOutcome.failed(ExecutionError.timedOut(limit));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.errorf(cause, "Worker %s: work item %d threw exception", workerId, item.id());
            return WorkOutcome.failed(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private IterationResult report(WorkItem item, WorkOutcome outcome) {
        WorkItem written;
        IterationResult result;
        try {
            if (outcome instanceof WorkOutcome.Completed completed) {
                String resultJson;
                try {
                    resultJson = serialize(completed.result());
                } catch (JsonProcessingException e) {
                    return reportFailure(item, ExecutionError.from(e));
                }
                written = store.complete(item.id(), workerId, item.claimGeneration(), resultJson);
                result = IterationResult.COMPLETED;
                log.infof("Worker %s completed work item %d", workerId, item.id());
            } else {
                return reportFailure(item, ((WorkOutcome.Failed) outcome).error());
            }
        } catch (WorkItemConflictException | WorkItemNotFoundException e) {
            return lostRace(item, e);
        }
        notifyFinished(written);
        return result;
    }

    private IterationResult reportFailure(WorkItem item, ExecutionError error) {
        WorkItem written;
        try {
            written = store.fail(item.id(), workerId, item.claimGeneration(), error.message(), error.category());
        } catch (WorkItemConflictException | WorkItemNotFoundException e) {
            return lostRace(item, e);
        }
        if (error.critical()) {
            log.errorf("CRITICAL: work item %d failed on worker %s [%s]: %s",
                    item.id(), workerId, error.category(), error.message());
        } else {
            log.infof("Worker %s failed work item %d [%s]: %s",
                    workerId, item.id(), error.category(), error.message());
        }
        notifyFinished(written);
        return IterationResult.FAILED;
    }

    private IterationResult lostRace(WorkItem item, RuntimeException e) {
        log.warnf("Worker %s lost work item %d (generation %d), discarding outcome: %s",
                workerId, item.id(), item.claimGeneration(), e.getMessage());
        return IterationResult.LOST_RACE;
    }

    private void notifyFinished(WorkItem item) {
        if (listener == null) return;
        try {
            listener.onFinished(item, workerId);
        } catch (RuntimeException e) {
            log.warnf(e, "Worker %s: finish listener failed for work item %d", workerId, item.id());
        }
    }

    private String serialize(Object value) throws JsonProcessingException {
        return value == null ? null : objectMapper.writeValueAsString(value);
    }

    private void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero()) {
            stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private synchronized ExecutorService executionThread() {
        if (executionThread == null) {
            executionThread = newExecutionThread();
        }
        return executionThread;
    }

    private ExecutorService newExecutionThread() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "work-exec-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }
}
