package com.sailfish.backoff.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Passed to the retry observer immediately before the executor waits out a delay.
 */
public final class RetryEvent {

    private final int attempt;
    private final Duration delay;
    private final Instant scheduledAt;
    private final Throwable error;

    public RetryEvent(int attempt, Duration delay, Instant scheduledAt, Throwable error) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be positive");
        this.attempt = attempt;
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        this.scheduledAt = scheduledAt;
        this.error = Objects.requireNonNull(error, "error cannot be null");
    }

    /**
     * @return Number of attempts completed so far, 1-based. The attempt that just failed.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * @return The delay about to be awaited.
     */
    public Duration getDelay() {
        return delay;
    }

    /**
     * @return The absolute deadline of this delay when the schedule was computed against a reference
     * instant. The executor does not time its wait against it.
     */
    public Optional<Instant> getScheduledAt() {
        return Optional.ofNullable(scheduledAt);
    }

    /**
     * @return The error that triggered the retry.
     */
    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "RetryEvent{attempt=" + attempt + ", delay=" + delay
                + (scheduledAt != null ? ", scheduledAt=" + scheduledAt : "")
                + ", error=" + error + "}";
    }
}
