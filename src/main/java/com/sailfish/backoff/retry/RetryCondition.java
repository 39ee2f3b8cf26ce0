package com.sailfish.backoff.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Decides whether a failed attempt is retried. The decision may be asynchronous, e.g. when it
 * depends on a remote lookup; the executor waits for the returned stage before it continues.
 * A failed stage, or an exception thrown from {@link #shouldRetry}, ends the execution with that error.
 */
@FunctionalInterface
public interface RetryCondition {

    /**
     * @param error The failure of the attempt that just finished.
     * @return A stage completing with true to retry. A null value counts as false.
     * @throws Exception to abort the execution.
     */
    CompletionStage<Boolean> shouldRetry(Throwable error) throws Exception;

    static RetryCondition never() {
        return error -> CompletableFuture.completedFuture(Boolean.FALSE);
    }

    /**
     * Adapts a synchronous predicate.
     */
    static RetryCondition of(Predicate<Throwable> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return error -> CompletableFuture.completedFuture(predicate.test(error));
    }
}
