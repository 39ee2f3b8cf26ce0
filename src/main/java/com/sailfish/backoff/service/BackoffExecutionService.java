package com.sailfish.backoff.service;

import com.sailfish.backoff.BackoffOperation;
import com.sailfish.backoff.error.ErrorClassifiers;
import com.sailfish.backoff.retry.BackoffConfig;
import com.sailfish.backoff.retry.DelaySchedule;
import com.sailfish.backoff.retry.RetryListener;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Service interface for running operations under a retry-with-backoff policy.
 */
public interface BackoffExecutionService {

    /**
     * Runs the operation, retrying failed attempts according to the config.
     *
     * The returned future completes
     * <ul>
     *     <li>with the value of the first successful attempt,</li>
     *     <li>exceptionally with the last attempt's error, unchanged, once attempts are exhausted or the
     *     error is not retryable,</li>
     *     <li>exceptionally with the error of the retryability predicate or retry listener if either fails,</li>
     *     <li>exceptionally with a {@link com.sailfish.backoff.exceptions.BackoffCancelledException} when the
     *     config's cancellation signal fires first.</li>
     * </ul>
     * Cancelling the returned future stops further attempts but does not interrupt one in flight.
     *
     * @param operation The operation; invoked once per attempt, never concurrently with itself.
     * @param config    Backoff configuration.
     * @param <T>       Result type.
     * @return The eventual result.
     */
    <T> CompletableFuture<T> executeWithBackoff(BackoffOperation<T> operation, BackoffConfig config);

    /**
     * Runs the operation with {@link BackoffConfig#defaults()}, which never retries.
     */
    default <T> CompletableFuture<T> executeWithBackoff(BackoffOperation<T> operation) {
        return executeWithBackoff(operation, BackoffConfig.defaults());
    }

    /**
     * Computes the delay schedule the config would produce, without running anything.
     */
    DelaySchedule computeDelaySchedule(BackoffConfig config);

    /**
     * Binds the operation and config into a reusable call. Each {@code get()} starts an independent execution.
     */
    default <T> Supplier<CompletableFuture<T>> decorate(BackoffOperation<T> operation, BackoffConfig config) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        return () -> executeWithBackoff(operation, config);
    }

    /**
     * Retries failures classified by {@link ErrorClassifiers#isNetworkError(Throwable)}, default config otherwise.
     */
    default <T> CompletableFuture<T> withNetworkBackoff(BackoffOperation<T> operation) {
        return withNetworkBackoff(operation, null);
    }

    default <T> CompletableFuture<T> withNetworkBackoff(BackoffOperation<T> operation, RetryListener listener) {
        return executeWithBackoff(operation, boundConfig(ErrorClassifiers::isNetworkError, listener));
    }

    /**
     * Retries failures classified by {@link ErrorClassifiers#isInternalServerError(Throwable)}, default config otherwise.
     */
    default <T> CompletableFuture<T> withInternalServerErrorBackoff(BackoffOperation<T> operation) {
        return withInternalServerErrorBackoff(operation, null);
    }

    default <T> CompletableFuture<T> withInternalServerErrorBackoff(BackoffOperation<T> operation, RetryListener listener) {
        return executeWithBackoff(operation, boundConfig(ErrorClassifiers::isInternalServerError, listener));
    }

    /**
     * Retries failures classified by {@link ErrorClassifiers#isConnectionErrorMessage(Throwable)}, default config otherwise.
     */
    default <T> CompletableFuture<T> withConnectionErrorMessageBackoff(BackoffOperation<T> operation) {
        return withConnectionErrorMessageBackoff(operation, null);
    }

    default <T> CompletableFuture<T> withConnectionErrorMessageBackoff(BackoffOperation<T> operation, RetryListener listener) {
        return executeWithBackoff(operation, boundConfig(ErrorClassifiers::isConnectionErrorMessage, listener));
    }

    /**
     * Initiates a graceful shutdown of the underlying executor services.
     * Should be called during application shutdown.
     *
     * @param timeoutSeconds Time to wait for running attempts to complete before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);

    /**
     * Default config with the given predicate and, when non-null, listener.
     */
    static BackoffConfig boundConfig(Predicate<Throwable> retryable, RetryListener listener) {
        return BackoffConfig.builder()
                .retryable(retryable)
                .retryListener(listener != null ? listener : RetryListener.noOp())
                .build();
    }

    /**
     * Blocks for the result of an execution and rethrows its fault without the
     * {@link ExecutionException} wrapper.
     *
     * @throws Exception the operation's error, the predicate's or listener's error, or a
     *                   {@link com.sailfish.backoff.exceptions.BackoffCancelledException}.
     */
    static <T> T await(CompletionStage<T> stage) throws Exception {
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
