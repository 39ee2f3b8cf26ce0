package com.sailfish.backoff.retry;

import com.sailfish.backoff.model.RetryEvent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Observer notified before each retry. The executor waits for the returned stage to complete
 * before it starts the delay; a failed stage, or an exception thrown from {@link #onRetry}, ends
 * the execution with that error.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param event The retry about to happen.
     * @return A stage the executor awaits, or null when the listener finished synchronously.
     * @throws Exception to abort the execution.
     */
    CompletionStage<?> onRetry(RetryEvent event) throws Exception;

    static RetryListener noOp() {
        return event -> null;
    }

    /**
     * Adapts a synchronous observer.
     */
    static RetryListener of(Consumer<RetryEvent> consumer) {
        Objects.requireNonNull(consumer, "consumer cannot be null");
        return event -> {
            consumer.accept(event);
            return CompletableFuture.completedFuture(null);
        };
    }
}
