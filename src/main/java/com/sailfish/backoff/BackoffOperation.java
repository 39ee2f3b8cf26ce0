package com.sailfish.backoff;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Represents a fallible asynchronous operation that can be re-invoked by the backoff executor.
 * Every call to {@link #execute()} is one attempt.
 *
 * @param <T> The type of the value produced on success.
 */
@FunctionalInterface
public interface BackoffOperation<T> {

    /**
     * Starts one attempt of the operation.
     *
     * @return A stage completing with the result, or exceptionally with the failure of this attempt.
     * @throws Exception if the attempt fails before a stage could be produced. Treated the same way
     *                   as an exceptionally completed stage.
     */
    CompletionStage<T> execute() throws Exception;

    /**
     * Adapts blocking code. The callable runs on the thread that starts the attempt.
     *
     * @param callable The blocking operation.
     * @param <T>      The result type.
     * @return An operation whose stages are already completed when returned.
     */
    static <T> BackoffOperation<T> fromCallable(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable cannot be null");
        return () -> CompletableFuture.completedFuture(callable.call());
    }
}
