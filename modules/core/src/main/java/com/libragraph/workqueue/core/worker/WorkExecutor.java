package com.libragraph.workqueue.core.worker;

import com.libragraph.workqueue.core.queue.WorkItem;

/**
 * The work itself. Supplied by the deploying application as an
 * {@code @ApplicationScoped} bean; the queue treats it as a black box.
 * <p>
 * The item is claimed when this is called. Implementations with external side
 * effects can fence them on {@link WorkItem#claimGeneration()}, since a slow
 * execution may be reclaimed and re-run elsewhere.
 */
public interface WorkExecutor {

    /**
     * Executes one claimed item. Throwing is equivalent to returning
     * {@link WorkOutcome#failed(Throwable)}. The thread is interrupted when the
     * configured execution timeout elapses.
     */
    WorkOutcome execute(WorkItem item) throws Exception;
}
