package com.sailfish.backoff.retry;

import java.time.Duration;

/**
 * Defines how the raw delay before a retry is derived from the retry index.
 * Jitter is not part of a strategy; it is applied on top by the {@link DelayScheduleGenerator}.
 */
public interface RetryStrategy {

    /**
     * Calculates the raw delay preceding a retry.
     *
     * @param index 0-based retry index. Index 0 is the wait before the second attempt.
     * @return The delay before jitter. Never negative.
     */
    Duration calculateDelay(int index);

}
