package com.libragraph.workqueue.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import com.libragraph.workqueue.core.recovery.StaleClaimReclaimer;
import com.libragraph.workqueue.core.worker.WorkOutcome;
import com.libragraph.workqueue.core.worker.WorkerLoop;
import com.libragraph.workqueue.core.worker.WorkerSettings;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class StaleClaimReclaimerTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(30);

    @Inject
    StaleClaimReclaimer reclaimer;

    @Inject
    WorkItemStore store;

    @Inject
    TestDatabase db;

    @Inject
    ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        db.clear();
    }

    @Test
    void staleClaimReturnsToPending() {
        long id = store.insert("{}");
        store.claimNext("w1");
        db.age(id, TIMEOUT.plusMinutes(1));

        assertThat(reclaimer.reclaim(TIMEOUT)).isEqualTo(1);

        WorkItem item = store.get(id).orElseThrow();
        assertThat(item.status()).isEqualTo(WorkItemStatus.PENDING);
        assertThat(item.owner()).isNull();
        assertThat(item.resetReason()).isEqualTo("timeout");
        assertThat(item.reclaimCount()).isEqualTo(1);
    }

    @Test
    void recentClaimIsNotReclaimed() {
        long id = store.insert("{}");
        store.claimNext("w1");
        db.age(id, TIMEOUT.minusMinutes(1));

        assertThat(reclaimer.reclaim(TIMEOUT)).isZero();
        assertThat(store.get(id).orElseThrow().owner()).isEqualTo("w1");
    }

    @Test
    void reclaimIsIdempotent() {
        long id = store.insert("{}");
        store.claimNext("w1");
        db.age(id, TIMEOUT.plusMinutes(1));

        assertThat(reclaimer.reclaim(TIMEOUT)).isEqualTo(1);
        assertThat(reclaimer.reclaim(TIMEOUT)).isZero();
        assertThat(store.get(id).orElseThrow().reclaimCount()).isEqualTo(1);
    }

    @Test
    void zeroTimeoutReclaimsEveryOlderClaim() {
        long a = store.insert("{}");
        long b = store.insert("{}");
        store.claimNext("w1");
        store.claimNext("w2");
        db.age(a, Duration.ofSeconds(1));
        db.age(b, Duration.ofSeconds(1));

        assertThat(reclaimer.reclaim(Duration.ZERO)).isEqualTo(2);
        assertThat(store.countByStatus()).containsEntry(WorkItemStatus.PENDING, 2L);
    }

    @Test
    void pendingAndTerminalItemsAreUntouched() {
        long pending = store.insert("{}");
        long done = store.insert("{}");
        db.setCreatedAgo(done, Duration.ofHours(2));
        WorkItem c = store.claimNext("w1").orElseThrow();
        store.complete(done, "w1", c.claimGeneration(), null);
        db.age(pending, Duration.ofHours(2));
        db.age(done, Duration.ofHours(2));

        assertThat(reclaimer.reclaim(TIMEOUT)).isZero();
        assertThat(store.get(pending).orElseThrow().status()).isEqualTo(WorkItemStatus.PENDING);
        assertThat(store.get(done).orElseThrow().status()).isEqualTo(WorkItemStatus.COMPLETED);
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> reclaimer.reclaim(Duration.ofMinutes(-1)));
    }

    @Test
    void workerThatOutlivesItsClaimLosesTheRace() throws Exception {
        long id = store.insert("{\"slow\":true}");
        WorkerSettings settings = new WorkerSettings(
                Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(100), Duration.ofSeconds(30));

        WorkerLoop slow = new WorkerLoop("slow", store, item -> {
            // the claim goes stale while we work: reclaimed and taken by another worker
            db.age(item.id(), TIMEOUT.plusMinutes(1));
            reclaimer.reclaim(TIMEOUT);
            store.claimNext("fast").orElseThrow();
            return WorkOutcome.completed("stale");
        }, objectMapper, settings, null);

        assertThat(slow.runOnce()).isEqualTo(WorkerLoop.IterationResult.LOST_RACE);

        WorkItem item = store.get(id).orElseThrow();
        assertThat(item.status()).isEqualTo(WorkItemStatus.PROCESSING);
        assertThat(item.owner()).isEqualTo("fast");
        assertThat(item.claimGeneration()).isEqualTo(2);
        assertThat(item.result()).isNull();

        WorkItem done = store.complete(id, "fast", 2, "{\"by\": \"fast\"}");
        assertThat(done.status()).isEqualTo(WorkItemStatus.COMPLETED);
    }
}
