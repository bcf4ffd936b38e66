package com.libragraph.workqueue.core.service;

import java.util.Optional;

/**
 * Contract for infrastructure with a managed lifecycle and dependency ordering.
 * State transitions fire {@link ServiceStateChangedEvent} via CDI.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    /** Cause of the most recent transition to FAILED, if any. */
    Optional<Throwable> lastFailure();

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
