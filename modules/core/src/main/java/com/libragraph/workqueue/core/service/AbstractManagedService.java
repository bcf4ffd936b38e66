package com.libragraph.workqueue.core.service;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for {@link ManagedService} beans: an atomic state machine that fires a
 * CDI event on every transition and checks {@link DependsOn} before starting.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public Optional<Throwable> lastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return;
        }

        verifyDependencies();

        transition(State.STARTING);
        try {
            doStart();
            lastFailure.set(null);
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        lastFailure.set(cause);
        State old = state.get();
        if (old == State.FAILED) {
            return;
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    /** Returns the {@code @DependsOn} classes declared on this service. */
    public List<Class<? extends ManagedService>> getDependencies() {
        List<Class<? extends ManagedService>> deps = new ArrayList<>();
        for (DependsOn d : getClass().getAnnotationsByType(DependsOn.class)) {
            deps.add(d.value());
        }
        return deps;
    }

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        stateEvent.fire(new ServiceStateChangedEvent(serviceId(), old, newState, Instant.now()));
    }

    private void verifyDependencies() {
        for (Class<? extends ManagedService> dep : getDependencies()) {
            for (ManagedService svc : allServices) {
                if (dep.isInstance(svc) && !svc.isRunning()) {
                    throw new IllegalStateException(
                            "Cannot start '" + serviceId() + "': dependency '"
                                    + svc.serviceId() + "' is " + svc.state());
                }
            }
        }
    }
}
