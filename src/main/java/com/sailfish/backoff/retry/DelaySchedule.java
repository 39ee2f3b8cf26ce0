package com.sailfish.backoff.retry;

import com.sailfish.backoff.model.ScheduledDelay;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The ordered delays of one backoff execution, one entry per retry. Entry 0 precedes the second
 * attempt; there is no entry for the first one.
 */
public final class DelaySchedule {

    private static final DelaySchedule EMPTY = new DelaySchedule(List.of());

    private final List<ScheduledDelay> entries;

    DelaySchedule(List<ScheduledDelay> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static DelaySchedule empty() {
        return EMPTY;
    }

    public List<ScheduledDelay> getEntries() {
        return entries;
    }

    /**
     * @return The relative delays, in consumption order.
     */
    public List<Duration> getDelays() {
        return entries.stream().map(ScheduledDelay::getDelay).collect(Collectors.toList());
    }

    public ScheduledDelay get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return A fresh queue over the entries, for a single consumer that pops them front to back.
     */
    public Deque<ScheduledDelay> toQueue() {
        return new ArrayDeque<>(entries);
    }

    @Override
    public String toString() {
        return "DelaySchedule" + entries;
    }
}
