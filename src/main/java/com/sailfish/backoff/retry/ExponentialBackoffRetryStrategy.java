package com.sailfish.backoff.retry;

import java.time.Duration;

/**
 * A retry strategy implementing exponential backoff: {@code initialDelay * multiplier^index}.
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final Duration initialDelay;
    private final double multiplier;

    /**
     * Creates a configurable ExponentialBackoffRetryStrategy.
     *
     * @param initialDelay Delay before the first retry.
     * @param multiplier Factor by which the delay increases for each subsequent retry. A multiplier
     *                   below 1 shrinks the delay; 0 yields zero delays after the first retry.
     */
    public ExponentialBackoffRetryStrategy(Duration initialDelay, double multiplier) {
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be non-negative");
        if (multiplier < 0 || !Double.isFinite(multiplier)) throw new IllegalArgumentException("multiplier must be a finite non-negative number");

        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
    }

    @Override
    public Duration calculateDelay(int index) {
        if (index < 0) throw new IllegalArgumentException("index must be non-negative");
        double delayNanos = DelayMath.toNanos(initialDelay) * Math.pow(multiplier, index);
        return DelayMath.ofNanos(delayNanos);
    }

    public Duration getInitialDelay() { return initialDelay; }
    public double getMultiplier() { return multiplier; }
}
