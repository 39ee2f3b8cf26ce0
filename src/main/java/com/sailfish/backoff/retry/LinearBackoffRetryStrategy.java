package com.sailfish.backoff.retry;

import java.time.Duration;

/**
 * A retry strategy waiting the same delay before every retry.
 */
public class LinearBackoffRetryStrategy implements RetryStrategy {

    private final Duration delay;

    public LinearBackoffRetryStrategy(Duration delay) {
        if (delay == null || delay.isNegative()) throw new IllegalArgumentException("delay must be non-negative");
        this.delay = delay;
    }

    @Override
    public Duration calculateDelay(int index) {
        if (index < 0) throw new IllegalArgumentException("index must be non-negative");
        return delay;
    }

    public Duration getDelay() { return delay; }
}
