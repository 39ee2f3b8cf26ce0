/**
 * Provides the core types of the backoff executor: the retried operation and the cancellation handle.
 * The retry loop itself lives in {@link com.sailfish.backoff.service}, its configuration and delay
 * schedule in {@link com.sailfish.backoff.retry}.
 */
package com.sailfish.backoff;
