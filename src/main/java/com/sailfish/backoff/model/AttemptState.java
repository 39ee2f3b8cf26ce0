package com.sailfish.backoff.model;

/**
 * States of a single backoff execution.
 */
public enum AttemptState {
    /**
     * Created, delay schedule computed, no attempt started yet.
     */
    READY,
    /**
     * An attempt of the operation is outstanding.
     */
    ATTEMPTING,
    /**
     * The last attempt failed with a retryable error; the observer is being notified or the delay awaited.
     */
    RETRYING,
    /**
     * An attempt produced a value.
     */
    SUCCEEDED,
    /**
     * Attempts exhausted, error not retryable, or the predicate or observer failed.
     */
    FAILED,
    /**
     * The cancellation signal fired before the run could finish.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
