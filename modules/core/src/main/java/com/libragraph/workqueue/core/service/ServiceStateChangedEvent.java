package com.libragraph.workqueue.core.service;

import java.time.Instant;

/**
 * Fired whenever a {@link ManagedService} changes state.
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp
) {}
