/**
 * Contains the backoff configuration and the delay schedule machinery: the raw-delay
 * {@link com.sailfish.backoff.retry.RetryStrategy} implementations, the jittering
 * {@link com.sailfish.backoff.retry.DelayScheduleGenerator} and the retry observer contract.
 */
package com.sailfish.backoff.retry;
