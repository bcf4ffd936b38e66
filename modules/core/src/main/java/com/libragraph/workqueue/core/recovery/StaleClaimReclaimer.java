package com.libragraph.workqueue.core.recovery;

import com.libragraph.workqueue.core.queue.StoreUnavailableException;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Returns items stuck in {@code processing} to the pool.
 * <p>
 * An item is stale when its {@code updated_at} is older than the timeout. The reset is a
 * single conditional update per sweep, so concurrent reclaimers never double-count an
 * item, and a worker that finishes after the reset loses its terminal write.
 */
@ApplicationScoped
public class StaleClaimReclaimer {

    public static final String REASON_TIMEOUT = "timeout";

    private static final Logger log = Logger.getLogger(StaleClaimReclaimer.class);

    @Inject
    WorkItemStore store;

    @ConfigProperty(name = "workqueue.reclaimer.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "workqueue.reclaimer.timeout", defaultValue = "30m")
    Duration timeout;

    public StaleClaimReclaimer() {
    }

    public StaleClaimReclaimer(WorkItemStore store, Duration timeout) {
        this.store = store;
        this.timeout = timeout;
        this.enabled = true;
    }

    @Scheduled(every = "${workqueue.reclaimer.interval:60s}", concurrentExecution = SKIP)
    public void sweep() {
        if (!enabled) return;
        try {
            reclaim(timeout);
        } catch (StoreUnavailableException e) {
            log.warnf("Reclaim sweep skipped, store unavailable: %s", e.getMessage());
        }
    }

    /**
     * Resets every {@code processing} item not updated within {@code timeout}.
     *
     * @return number of items returned to {@code pending}
     */
    public int reclaim(Duration timeout) {
        List<WorkItem> reclaimed = store.reclaimStale(timeout, REASON_TIMEOUT);
        for (WorkItem item : reclaimed) {
            log.warnf("Work item %d reclaimed (claim generation %d, reclaim #%d)",
                    item.id(), item.claimGeneration(), item.reclaimCount());
        }
        if (!reclaimed.isEmpty()) {
            log.infof("Reclaimed %d stale work item(s) older than %s", reclaimed.size(), timeout);
        }
        return reclaimed.size();
    }

    public Duration timeout() {
        return timeout;
    }
}
