package com.libragraph.workqueue.core.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, concurrently accessed persistence of {@link WorkItem}s.
 *
 * <p>All coordination between workers goes through the conditional writes of this
 * interface; implementations must not rely on in-process locks.
 *
 * <p>Every method may throw {@link StoreUnavailableException} when the backing
 * store cannot be reached.
 */
public interface WorkItemStore {

    /**
     * Creates a new {@link WorkItemStatus#PENDING} item.
     *
     * @param payloadJson JSON document describing the work (may be null)
     * @return the new item's id
     */
    long insert(String payloadJson);

    Optional<WorkItem> get(long id);

    /**
     * Conditionally moves an item from {@code expected} to {@code next}.
     * Leaving {@link WorkItemStatus#PROCESSING} clears the owner.
     *
     * @return the item as written
     * @throws IllegalStateTransitionException if the lifecycle forbids the edge,
     *                                         or {@code next} is PROCESSING (only a claim may set it)
     * @throws WorkItemConflictException       if the item's state did not match at write time
     * @throws WorkItemNotFoundException       if no item has this id
     */
    WorkItem updateStatus(long id, WorkItemStatus expected, WorkItemStatus next, StatusUpdate fields);

    /**
     * Atomically claims the oldest pending item (by {@code created_at}, then {@code id})
     * for {@code workerId}. Concurrent callers never receive the same item.
     *
     * @return the claimed item, or empty when no item is pending
     */
    Optional<WorkItem> claimNext(String workerId);

    /**
     * Returns every PROCESSING item whose {@code updated_at} is older than
     * {@code now - timeout} to PENDING, annotated with {@code reason}.
     *
     * @return the reclaimed items as written
     */
    List<WorkItem> reclaimStale(Duration timeout, String reason);

    List<WorkItem> list(WorkItemStatus status, int limit);

    Map<WorkItemStatus, Long> countByStatus();

    default WorkItem complete(long id, String owner, int generation, String resultJson) {
        return updateStatus(id, WorkItemStatus.PROCESSING, WorkItemStatus.COMPLETED,
                StatusUpdate.completed(owner, generation, resultJson));
    }

    default WorkItem fail(long id, String owner, int generation, String error, String errorCategory) {
        return updateStatus(id, WorkItemStatus.PROCESSING, WorkItemStatus.FAILED,
                StatusUpdate.failed(owner, generation, error, errorCategory));
    }

    /** Validates an edge requested through {@link #updateStatus}. */
    static void checkTransition(WorkItemStatus expected, WorkItemStatus next) {
        if (next == WorkItemStatus.PROCESSING) {
            throw new IllegalStateTransitionException(expected, next, "ownership is only granted by claimNext");
        }
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(expected, next,
                    expected.isTerminal() ? "item is already terminal" : "edge not in lifecycle");
        }
    }
}
