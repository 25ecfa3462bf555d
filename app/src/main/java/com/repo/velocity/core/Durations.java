package com.repo.velocity.core;

import java.time.Duration;

/**
 * Duration helpers shared by the record types and the DORA calculator.
 */
public final class Durations {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private Durations() {
    }

    /**
     * Fractional hours, millisecond precision.
     */
    public static double hours(Duration duration) {
        return duration.toMillis() / 1000.0 / SECONDS_PER_HOUR;
    }
}
