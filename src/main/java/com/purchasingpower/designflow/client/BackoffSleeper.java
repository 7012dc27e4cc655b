package com.purchasingpower.designflow.client;

import java.time.Duration;

/**
 * Waits between API calls. Tests replace it with a recorder so nothing actually sleeps.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration duration);

    static BackoffSleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting " + duration.toMillis() + "ms", e);
            }
        };
    }
}
