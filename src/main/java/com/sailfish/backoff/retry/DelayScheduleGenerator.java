package com.sailfish.backoff.retry;

import com.sailfish.backoff.model.BackoffStrategy;
import com.sailfish.backoff.model.ScheduledDelay;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the delay schedule of a backoff execution up front.
 *
 * For {@code maxAttempts} attempts the schedule holds {@code maxAttempts - 1} delays. Entry {@code i}
 * is the raw delay of the configured {@link RetryStrategy} at index {@code i} plus
 * {@code raw * jitter * U}, with U drawn per entry from [0, 1). Jitter therefore only ever lengthens a delay.
 *
 * Stateless apart from the random source; safe for concurrent use when the source is.
 */
public class DelayScheduleGenerator {

    private final DoubleSupplier random;

    public DelayScheduleGenerator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random Source of uniform values in [0, 1) used for jitter.
     */
    public DelayScheduleGenerator(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    public DelaySchedule generate(BackoffConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return generate(config.getMaxAttempts(), config.getInitialDelay(), config.getDelayFactor(),
                config.getJitter(), config.getStrategy(), config.getReferenceInstant().orElse(null));
    }

    /**
     * Low-level form that skips {@link BackoffConfig} validation for the attempt count.
     *
     * @param maxAttempts      Total attempts. Zero or less yields an empty schedule.
     * @param initialDelay     Base delay, non-negative.
     * @param delayFactor      Growth factor, used by the exponential strategy only.
     * @param jitter           Random extra fraction. Values above 1 give proportionally larger variance;
     *                         negative values are treated as 0.
     * @param strategy         Backoff strategy.
     * @param referenceInstant Optional; when present every entry also carries {@code referenceInstant + delay}.
     */
    public DelaySchedule generate(int maxAttempts, Duration initialDelay, double delayFactor, double jitter,
                                  BackoffStrategy strategy, Instant referenceInstant) {
        if (maxAttempts <= 1) {
            return DelaySchedule.empty();
        }
        RetryStrategy retryStrategy = strategyFor(strategy, initialDelay, delayFactor);
        double effectiveJitter = Double.isNaN(jitter) || jitter < 0 ? 0 : jitter;

        List<ScheduledDelay> entries = new ArrayList<>(maxAttempts - 1);
        for (int i = 0; i < maxAttempts - 1; i++) {
            Duration raw = retryStrategy.calculateDelay(i);
            Duration delay = applyJitter(raw, effectiveJitter);
            Instant deadline = referenceInstant != null ? plusSaturated(referenceInstant, delay) : null;
            entries.add(new ScheduledDelay(delay, deadline));
        }
        return new DelaySchedule(entries);
    }

    private Duration applyJitter(Duration raw, double jitter) {
        if (jitter == 0 || raw.isZero()) {
            return raw;
        }
        double rawNanos = DelayMath.toNanos(raw);
        return DelayMath.ofNanos(rawNanos + rawNanos * jitter * random.getAsDouble());
    }

    private static Instant plusSaturated(Instant reference, Duration delay) {
        try {
            return reference.plus(delay);
        } catch (ArithmeticException | DateTimeException e) {
            return Instant.MAX;
        }
    }

    static RetryStrategy strategyFor(BackoffStrategy strategy, Duration initialDelay, double delayFactor) {
        Objects.requireNonNull(strategy, "strategy cannot be null");
        switch (strategy) {
            case EXPONENTIAL:
                return new ExponentialBackoffRetryStrategy(initialDelay, delayFactor);
            case LINEAR:
                return new LinearBackoffRetryStrategy(initialDelay);
            default:
                throw new IllegalArgumentException("Unsupported backoff strategy: " + strategy);
        }
    }
}
