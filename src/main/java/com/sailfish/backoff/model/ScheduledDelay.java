package com.sailfish.backoff.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a delay schedule: the wait preceding a retry and, when the schedule was computed
 * against a reference instant, the absolute point in time that wait corresponds to.
 */
public final class ScheduledDelay {

    private final Duration delay;
    private final Instant deadline;

    public ScheduledDelay(Duration delay, Instant deadline) {
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        this.deadline = deadline;
    }

    public static ScheduledDelay relative(Duration delay) {
        return new ScheduledDelay(delay, null);
    }

    /**
     * @return The duration to wait before the retry. Always relative, whatever mode produced the schedule.
     */
    public Duration getDelay() {
        return delay;
    }

    /**
     * @return {@code referenceInstant + delay}, present only for schedules computed against a reference instant.
     */
    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduledDelay that = (ScheduledDelay) o;
        return delay.equals(that.delay) && Objects.equals(deadline, that.deadline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delay, deadline);
    }

    @Override
    public String toString() {
        return deadline == null ? "ScheduledDelay{" + delay + "}" : "ScheduledDelay{" + delay + " -> " + deadline + "}";
    }
}
