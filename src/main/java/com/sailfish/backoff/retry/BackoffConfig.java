package com.sailfish.backoff.retry;

import com.sailfish.backoff.CancellationSignal;
import com.sailfish.backoff.model.BackoffStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable configuration of one backoff execution.
 *
 * Use {@link #builder()}; every field has a default:
 * <ul>
 *     <li>maxAttempts: 6 (total invocations, including the first)</li>
 *     <li>initialDelay: 20 ms</li>
 *     <li>delayFactor: 4 (exponential strategy only)</li>
 *     <li>jitter: 0</li>
 *     <li>strategy: {@link BackoffStrategy#EXPONENTIAL}</li>
 *     <li>retryListener: no-op</li>
 *     <li>retryCondition: never retry</li>
 *     <li>cancellationSignal: none</li>
 *     <li>referenceInstant: none</li>
 * </ul>
 */
public final class BackoffConfig {

    public static final int DEFAULT_MAX_ATTEMPTS = 6;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(20);
    public static final double DEFAULT_DELAY_FACTOR = 4.0;
    public static final double DEFAULT_JITTER = 0.0;
    public static final BackoffStrategy DEFAULT_STRATEGY = BackoffStrategy.EXPONENTIAL;

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double delayFactor;
    private final double jitter;
    private final BackoffStrategy strategy;
    private final RetryListener retryListener;
    private final RetryCondition retryCondition;
    private final CancellationSignal cancellationSignal;
    private final Instant referenceInstant;

    private BackoffConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.delayFactor = builder.delayFactor;
        this.jitter = builder.jitter;
        this.strategy = builder.strategy;
        this.retryListener = builder.retryListener;
        this.retryCondition = builder.retryCondition;
        this.cancellationSignal = builder.cancellationSignal;
        this.referenceInstant = builder.referenceInstant;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A config with every default applied.
     */
    public static BackoffConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .delayFactor(delayFactor)
                .jitter(jitter)
                .strategy(strategy)
                .retryListener(retryListener)
                .retryCondition(retryCondition)
                .cancellationSignal(cancellationSignal)
                .referenceInstant(referenceInstant);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInitialDelay() { return initialDelay; }
    public double getDelayFactor() { return delayFactor; }
    public double getJitter() { return jitter; }
    public BackoffStrategy getStrategy() { return strategy; }
    public RetryListener getRetryListener() { return retryListener; }
    public RetryCondition getRetryCondition() { return retryCondition; }
    public Optional<CancellationSignal> getCancellationSignal() { return Optional.ofNullable(cancellationSignal); }
    public Optional<Instant> getReferenceInstant() { return Optional.ofNullable(referenceInstant); }

    @Override
    public String toString() {
        return "BackoffConfig{maxAttempts=" + maxAttempts
                + ", initialDelay=" + initialDelay
                + ", delayFactor=" + delayFactor
                + ", jitter=" + jitter
                + ", strategy=" + strategy
                + ", cancellable=" + (cancellationSignal != null)
                + (referenceInstant != null ? ", referenceInstant=" + referenceInstant : "")
                + "}";
    }

    public static final class Builder {

        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private double delayFactor = DEFAULT_DELAY_FACTOR;
        private double jitter = DEFAULT_JITTER;
        private BackoffStrategy strategy = DEFAULT_STRATEGY;
        private RetryListener retryListener = RetryListener.noOp();
        private RetryCondition retryCondition = RetryCondition.never();
        private CancellationSignal cancellationSignal;
        private Instant referenceInstant;

        private Builder() {
        }

        /**
         * @param maxAttempts Total invocations allowed, including the first. Must be at least 1.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * @param initialDelay First delay for the exponential strategy, the constant delay for the linear one.
         */
        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder initialDelayMillis(long initialDelayMillis) {
            return initialDelay(Duration.ofMillis(initialDelayMillis));
        }

        public Builder delayFactor(double delayFactor) {
            this.delayFactor = delayFactor;
            return this;
        }

        /**
         * @param jitter Fraction in [0, 1]. Each delay gains up to {@code delay * jitter} of random extra wait.
         */
        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder retryListener(RetryListener retryListener) {
            this.retryListener = retryListener;
            return this;
        }

        /**
         * @param retryable Decides whether a failed attempt is retried. Not consulted once the
         *                  attempt budget is spent.
         */
        public Builder retryable(Predicate<Throwable> retryable) {
            this.retryCondition = retryable != null ? RetryCondition.of(retryable) : null;
            return this;
        }

        /**
         * Asynchronous form of {@link #retryable(Predicate)}. Replaces any predicate set before.
         */
        public Builder retryCondition(RetryCondition retryCondition) {
            this.retryCondition = retryCondition;
            return this;
        }

        public Builder cancellationSignal(CancellationSignal cancellationSignal) {
            this.cancellationSignal = cancellationSignal;
            return this;
        }

        /**
         * @param referenceInstant When set, every scheduled delay also carries
         *                         {@code referenceInstant + delay}, reported as {@code RetryEvent#getScheduledAt()}.
         */
        public Builder referenceInstant(Instant referenceInstant) {
            this.referenceInstant = referenceInstant;
            return this;
        }

        /**
         * @throws IllegalArgumentException if maxAttempts is below 1, initialDelay is negative,
         *                                  delayFactor is negative or not finite, or jitter lies outside [0, 1].
         */
        public BackoffConfig build() {
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
            if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be non-negative");
            if (delayFactor < 0 || !Double.isFinite(delayFactor)) throw new IllegalArgumentException("delayFactor must be a finite non-negative number");
            if (!(jitter >= 0 && jitter <= 1)) throw new IllegalArgumentException("jitter must be within [0, 1]");
            Objects.requireNonNull(strategy, "strategy cannot be null");
            Objects.requireNonNull(retryListener, "retryListener cannot be null");
            Objects.requireNonNull(retryCondition, "retryCondition cannot be null");
            return new BackoffConfig(this);
        }
    }
}
