package com.libragraph.workqueue.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.workqueue.core.queue.InMemoryWorkItemStore;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import com.libragraph.workqueue.core.worker.WorkerLoop.IterationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class WorkerLoopTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(30);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryWorkItemStore store;
    private List<WorkItem> finished;
    private final List<WorkerLoop> created = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkItemStore();
        finished = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        created.forEach(WorkerLoop::close);
        created.clear();
    }

    private WorkerLoop loop(String workerId, WorkExecutor executor) {
        return loop(workerId, executor, Duration.ofSeconds(5));
    }

    private WorkerLoop loop(String workerId, WorkExecutor executor, Duration executionTimeout) {
        WorkerSettings settings = new WorkerSettings(
                Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(50), executionTimeout);
        WorkerLoop loop = new WorkerLoop(workerId, store, executor, objectMapper, settings,
                (item, worker) -> finished.add(item));
        created.add(loop);
        return loop;
    }

    private static boolean threadAlive(String name) {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.isAlive() && t.getName().equals(name));
    }

    private static boolean awaitThreadGone(String name, Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();
        while (threadAlive(name) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        return !threadAlive(name);
    }

    @Test
    void emptyPoolLeavesStoreUntouched() throws Exception {
        WorkerLoop w = loop("w1", item -> fail("nothing to execute"));

        assertThat(w.runOnce()).isEqualTo(IterationResult.EMPTY);
        assertThat(w.phase()).isEqualTo(WorkerLoop.Phase.IDLE);
        assertThat(store.countByStatus()).containsValues(0L, 0L, 0L, 0L);
    }

    @Test
    void happyPathStoresResultAndClearsOwner() throws Exception {
        long id = store.insert("{\"n\":1}");
        WorkerLoop w = loop("w1", item -> WorkOutcome.completed(Map.of("echo", item.payload())));

        assertThat(w.runOnce()).isEqualTo(IterationResult.COMPLETED);

        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.COMPLETED);
        assertThat(item.owner()).isNull();
        assertThat(item.result()).isEqualTo("{\"echo\":\"{\\\"n\\\":1}\"}");
        assertThat(item.finishedAt()).isNotNull();
        assertThat(finished).extracting(WorkItem::id).containsExactly(id);
    }

    @Test
    void nullOutcomeCountsAsCompletedWithoutResult() throws Exception {
        long id = store.insert(null);
        WorkerLoop w = loop("w1", item -> null);

        assertThat(w.runOnce()).isEqualTo(IterationResult.COMPLETED);
        assertThat(store.require(id).result()).isNull();
    }

    @Test
    void failedOutcomeIsRecordedWithCategory() throws Exception {
        long id = store.insert("{}");
        WorkerLoop w = loop("w1", item -> WorkOutcome.failed("API rate limit exceeded"));

        assertThat(w.runOnce()).isEqualTo(IterationResult.FAILED);

        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.FAILED);
        assertThat(item.error()).isEqualTo("API rate limit exceeded");
        assertThat(item.errorCategory()).isEqualTo(ExecutionError.QUOTA_EXCEEDED);
        assertThat(item.owner()).isNull();
    }

    @Test
    void failedOutcomeWithoutErrorRecordsUnknownError() throws Exception {
        long id = store.insert("{}");
        WorkerLoop w = loop("w1", item -> new WorkOutcome.Failed(null));

        assertThat(w.runOnce()).isEqualTo(IterationResult.FAILED);

        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.FAILED);
        assertThat(item.error()).isEqualTo(ExecutionError.UNKNOWN_MESSAGE);
        assertThat(item.errorCategory()).isEqualTo(ExecutionError.UNKNOWN_ERROR);
    }

    @Test
    void executorExceptionBecomesFailure() throws Exception {
        long id = store.insert("{}");
        WorkerLoop w = loop("w1", item -> {
            throw new IllegalStateException("connection refused by upstream");
        });

        assertThat(w.runOnce()).isEqualTo(IterationResult.FAILED);

        WorkItem item = store.require(id);
        assertThat(item.error()).isEqualTo("connection refused by upstream");
        assertThat(item.errorCategory()).isEqualTo(ExecutionError.NETWORK_ERROR);
    }

    @Test
    void executionTimeoutFailsTheItem() throws Exception {
        long id = store.insert("{}");
        WorkerLoop w = loop("w1", item -> {
            Thread.sleep(10_000);
            return WorkOutcome.completed("late");
        }, Duration.ofMillis(100));

        assertThat(w.runOnce()).isEqualTo(IterationResult.FAILED);

        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.FAILED);
        assertThat(item.errorCategory()).isEqualTo(ExecutionError.TIMEOUT);
    }

    @Test
    void resultOfReclaimedExecutionIsDiscarded() throws Exception {
        long id = store.insert("{}");
        WorkerLoop slow = loop("slow", item -> {
            // meanwhile: the claim goes stale, is reclaimed and claimed by another worker
            store.advance(TIMEOUT.plusMinutes(1));
            assertThat(store.reclaimStale(TIMEOUT, "timeout")).hasSize(1);
            assertThat(store.claimNext("fast")).isPresent();
            return WorkOutcome.completed("stale result");
        });

        assertThat(slow.runOnce()).isEqualTo(IterationResult.LOST_RACE);

        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.PROCESSING);
        assertThat(item.owner()).isEqualTo("fast");
        assertThat(item.claimGeneration()).isEqualTo(2);
        assertThat(item.reclaimCount()).isEqualTo(1);
        assertThat(item.result()).isNull();
        assertThat(finished).isEmpty();
    }

    @Test
    void sameWorkerCannotFinishAnOlderClaim() throws Exception {
        long id = store.insert("{}");
        // reclaimed and re-claimed by the same worker id: only the generation tells them apart
        WorkerLoop w = loop("w1", item -> {
            store.advance(TIMEOUT.plusMinutes(1));
            store.reclaimStale(TIMEOUT, "timeout");
            store.claimNext("w1");
            return WorkOutcome.failed("first attempt");
        });

        assertThat(w.runOnce()).isEqualTo(IterationResult.LOST_RACE);
        assertThat(store.require(id).status()).isEqualTo(WorkItemStatus.PROCESSING);
        assertThat(store.require(id).error()).isNull();
    }

    @Test
    void claimDuringOutageReportsStoreUnavailable() throws Exception {
        store.insert("{}");
        store.goOffline();
        WorkerLoop w = loop("w1", item -> WorkOutcome.completed(null));

        assertThat(w.runOnce()).isEqualTo(IterationResult.STORE_UNAVAILABLE);

        store.goOnline();
        assertThat(store.countByStatus()).containsEntry(WorkItemStatus.PENDING, 1L);
    }

    @Test
    void outageWhileReportingLeavesItemProcessing() throws Exception {
        long id = store.insert("{}");
        WorkerLoop w = loop("w1", item -> {
            store.goOffline();
            return WorkOutcome.completed("done");
        });

        assertThat(w.runOnce()).isEqualTo(IterationResult.STORE_UNAVAILABLE);

        store.goOnline();
        WorkItem item = store.require(id);
        assertThat(item.status()).isEqualTo(WorkItemStatus.PROCESSING);
        assertThat(item.owner()).isEqualTo("w1");
    }

    @Test
    void listenerFailureDoesNotAffectOutcome() throws Exception {
        long id = store.insert("{}");
        WorkerSettings settings = new WorkerSettings(
                Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(5));
        WorkerLoop w = new WorkerLoop("w1", store, item -> WorkOutcome.completed(1), objectMapper, settings,
                (item, worker) -> {
                    throw new IllegalStateException("listener down");
                });

        assertThat(w.runOnce()).isEqualTo(IterationResult.COMPLETED);
        assertThat(store.require(id).status()).isEqualTo(WorkItemStatus.COMPLETED);
    }

    @Test
    void runDrainsPoolUntilStopped() throws Exception {
        for (int i = 0; i < 5; i++) store.insert("{\"i\":" + i + "}");
        WorkerLoop w = loop("w1", item -> WorkOutcome.completed(item.id()));

        Thread t = new Thread(w, "test-worker");
        t.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (finished.size() < 5 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        w.stop();
        t.join(5_000);

        assertThat(t.isAlive()).isFalse();
        assertThat(w.isRunning()).isFalse();
        assertThat(store.countByStatus()).containsEntry(WorkItemStatus.COMPLETED, 5L);
        assertThat(w.lastPoll()).isNotNull();
    }

    @Test
    void emptyPollsStartNoExecutionThread() throws Exception {
        WorkerLoop w = loop("idle-exec", item -> fail("nothing to execute"));

        assertThat(w.runOnce()).isEqualTo(IterationResult.EMPTY);
        assertThat(w.runOnce()).isEqualTo(IterationResult.EMPTY);

        assertThat(threadAlive("work-exec-idle-exec")).isFalse();
    }

    @Test
    void closeReleasesExecutionThread() throws Exception {
        store.insert("{}");
        store.insert("{}");
        WorkerLoop w = new WorkerLoop("closing-exec", store, item -> WorkOutcome.completed(1), objectMapper,
                new WorkerSettings(Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(50),
                        Duration.ofSeconds(5)),
                (item, worker) -> finished.add(item));

        assertThat(w.runOnce()).isEqualTo(IterationResult.COMPLETED);
        assertThat(threadAlive("work-exec-closing-exec")).isTrue();

        w.close();
        assertThat(awaitThreadGone("work-exec-closing-exec", Duration.ofSeconds(2))).isTrue();

        // a closed loop can still execute; it starts a fresh thread
        assertThat(w.runOnce()).isEqualTo(IterationResult.COMPLETED);
        w.close();
        assertThat(awaitThreadGone("work-exec-closing-exec", Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void rejectsBlankWorkerId() {
        assertThatIllegalArgumentException().isThrownBy(() -> loop(" ", item -> null));
    }
}
