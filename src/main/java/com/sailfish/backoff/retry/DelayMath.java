package com.sailfish.backoff.retry;

import java.time.Duration;

/**
 * Floating point conversions for delays. Values beyond the range of a {@code long} of nanoseconds
 * saturate instead of overflowing.
 */
final class DelayMath {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private DelayMath() {
    }

    static double toNanos(Duration duration) {
        return duration.getSeconds() * NANOS_PER_SECOND + duration.getNano();
    }

    static Duration ofNanos(double nanos) {
        if (Double.isNaN(nanos) || nanos <= 0) {
            return Duration.ZERO;
        }
        // Math.round saturates at Long.MAX_VALUE
        return Duration.ofNanos(Math.round(Math.min(nanos, (double) Long.MAX_VALUE)));
    }
}
