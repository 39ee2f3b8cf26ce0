package com.sailfish.backoff.model;

/**
 * The rule mapping a retry index to its raw delay.
 */
public enum BackoffStrategy {
    /**
     * Delay grows geometrically: {@code initialDelay * delayFactor^index}.
     */
    EXPONENTIAL,
    /**
     * Delay stays at {@code initialDelay} for every retry. The delay factor is ignored.
     */
    LINEAR
}
