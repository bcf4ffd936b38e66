package com.libragraph.workqueue.core.worker;

import java.time.Duration;

/**
 * Timing knobs of a {@link WorkerLoop}.
 *
 * @param pollInterval     sleep after a claim finds no pending item
 * @param backoffInitial   first sleep after the store was unavailable; doubles per consecutive failure
 * @param backoffMax       cap for the backoff
 * @param executionTimeout limit for one execution; zero disables it
 */
public record WorkerSettings(
        Duration pollInterval,
        Duration backoffInitial,
        Duration backoffMax,
        Duration executionTimeout
) {

    public WorkerSettings {
        requireNonNegative("pollInterval", pollInterval);
        requireNonNegative("backoffInitial", backoffInitial);
        requireNonNegative("backoffMax", backoffMax);
        requireNonNegative("executionTimeout", executionTimeout);
    }

    /** Backoff before retry number {@code attempt} (1-based). */
    public Duration backoff(int attempt) {
        Duration d = backoffInitial;
        for (int i = 1; i < attempt && d.compareTo(backoffMax) < 0; i++) {
            d = d.multipliedBy(2);
        }
        return d.compareTo(backoffMax) > 0 ? backoffMax : d;
    }

    private static void requireNonNegative(String name, Duration d) {
        if (d == null || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a non-negative duration: " + d);
        }
    }
}
