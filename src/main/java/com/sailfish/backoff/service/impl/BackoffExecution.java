package com.sailfish.backoff.service.impl;

import com.sailfish.backoff.BackoffOperation;
import com.sailfish.backoff.CancellationSignal;
import com.sailfish.backoff.exceptions.BackoffCancelledException;
import com.sailfish.backoff.model.AttemptState;
import com.sailfish.backoff.model.RetryEvent;
import com.sailfish.backoff.model.ScheduledDelay;
import com.sailfish.backoff.retry.BackoffConfig;
import com.sailfish.backoff.retry.DelaySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One run of the retry loop for a single operation. Each {@link #run()} is one attempt; retries are
 * re-submitted to the task executor once their delay, timed on the scheduler, has elapsed.
 *
 * Only one attempt or delay is outstanding at any time, so the mutable state below has a single
 * writer at a time. Handoffs between threads go through the executors and the completion of
 * stages, which order the writes.
 */
class BackoffExecution<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BackoffExecution.class);

    private final BackoffOperation<T> operation;
    private final BackoffConfig config;
    private final Deque<ScheduledDelay> delays;
    private final Executor taskExecutor;
    private final ScheduledExecutorService schedulerExecutor;
    private final CancellationSignal signal;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicInteger attemptsStarted = new AtomicInteger();

    private volatile AttemptState state = AttemptState.READY;
    private volatile int attempt = 1;

    BackoffExecution(BackoffOperation<T> operation,
                     BackoffConfig config,
                     DelaySchedule schedule,
                     Executor taskExecutor,
                     ScheduledExecutorService schedulerExecutor) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.delays = Objects.requireNonNull(schedule, "schedule cannot be null").toQueue();
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.signal = config.getCancellationSignal().orElse(null);
    }

    /**
     * Submits the first attempt.
     *
     * @return The future completed once the run reaches a terminal state.
     */
    CompletableFuture<T> start() {
        log.debug("Starting backoff execution with {}", config);
        dispatchAttempt();
        return result;
    }

    @Override
    public void run() {
        // 1. Nothing to do if the caller gave up or cancellation was signalled before this attempt
        if (result.isDone()) {
            log.debug("Result already completed externally. Skipping attempt {}.", attempt);
            return;
        }
        if (signal != null && signal.isCancelled()) {
            cancel(signal.getReason(), null);
            return;
        }

        // 2. Invoke the operation
        transition(AttemptState.ATTEMPTING);
        int current = attempt;
        attemptsStarted.incrementAndGet();
        log.debug("Starting attempt {}/{}", current, config.getMaxAttempts());

        CompletionStage<T> stage;
        try {
            stage = operation.execute();
            if (stage == null) {
                throw new NullPointerException("operation returned a null stage");
            }
        } catch (Throwable e) {
            onAttemptFailed(e);
            return;
        }

        // 3. Race the attempt against cancellation. Registering the stage callback first lets an
        //    already completed attempt win over a signal that fires concurrently.
        AtomicBoolean settled = new AtomicBoolean();
        AtomicReference<CancellationSignal.Subscription> subscription = new AtomicReference<>();
        stage.whenComplete((value, error) -> {
            if (!settled.compareAndSet(false, true)) {
                log.debug("Attempt {} finished after cancellation; outcome discarded.", current);
                return;
            }
            unsubscribe(subscription);
            if (error == null) {
                succeed(value);
            } else {
                onAttemptFailed(unwrap(error));
            }
        });
        if (signal != null && !settled.get()) {
            subscription.set(signal.onCancel(reason -> {
                if (settled.compareAndSet(false, true)) {
                    log.debug("Cancellation won the race against attempt {}.", current);
                    cancel(reason, null);
                }
            }));
            if (settled.get()) {
                unsubscribe(subscription);
            }
        }
    }

    private void onAttemptFailed(Throwable error) {
        int current = attempt;
        log.debug("Attempt {}/{} failed: {}", current, config.getMaxAttempts(), error.toString());

        // 4. Budget spent: the retry condition is not consulted
        if (current >= config.getMaxAttempts()) {
            log.debug("Attempt budget of {} exhausted.", config.getMaxAttempts());
            fail(error);
            return;
        }

        // 5. Classify, possibly asynchronously
        CompletionStage<Boolean> decision;
        try {
            decision = config.getRetryCondition().shouldRetry(error);
            if (decision == null) {
                throw new NullPointerException("retry condition returned a null stage");
            }
        } catch (Throwable e) {
            log.debug("Retry condition failed on attempt {}: {}", current, e.toString());
            fail(e);
            return;
        }
        decision.whenComplete((retryable, conditionError) -> {
            if (conditionError != null) {
                log.debug("Retry condition failed on attempt {}: {}", current, conditionError.toString());
                fail(unwrap(conditionError));
            } else if (!Boolean.TRUE.equals(retryable)) {
                log.debug("Error of attempt {} is not retryable.", current);
                fail(error);
            } else {
                notifyRetry(current, error);
            }
        });
    }

    private void notifyRetry(int current, Throwable error) {
        ScheduledDelay next = delays.poll();
        if (next == null) {
            log.error("Delay schedule exhausted before attempt {} of {}. Failing execution.", current, config.getMaxAttempts());
            fail(error);
            return;
        }

        // 6. Notify the observer, then wait
        transition(AttemptState.RETRYING);
        RetryEvent event = new RetryEvent(current, next.getDelay(), next.getDeadline().orElse(null), error);
        CompletionStage<?> notified;
        try {
            notified = config.getRetryListener().onRetry(event);
        } catch (Throwable e) {
            log.debug("Retry listener failed for attempt {}: {}", current, e.toString());
            fail(e);
            return;
        }
        if (notified == null) {
            awaitDelay(next, error);
            return;
        }
        notified.whenComplete((ignored, listenerError) -> {
            if (listenerError != null) {
                fail(unwrap(listenerError));
            } else {
                awaitDelay(next, error);
            }
        });
    }

    private void awaitDelay(ScheduledDelay next, Throwable error) {
        if (result.isDone()) {
            return;
        }
        if (signal != null && signal.isCancelled()) {
            cancel(signal.getReason(), error);
            return;
        }

        // Subscribe before arming the timer, so an elapsed timer always finds its subscription to remove
        AtomicBoolean settled = new AtomicBoolean();
        AtomicReference<ScheduledFuture<?>> timer = new AtomicReference<>();
        CancellationSignal.Subscription subscription = null;
        if (signal != null) {
            subscription = signal.onCancel(reason -> {
                if (settled.compareAndSet(false, true)) {
                    cancelTimer(timer);
                    log.debug("Cancellation interrupted the {} delay after attempt {}.", next.getDelay(), attempt);
                    cancel(reason, error);
                }
            });
        }
        CancellationSignal.Subscription registered = subscription;
        log.trace("Waiting {} before attempt {}", next.getDelay(), attempt + 1);
        try {
            timer.set(schedulerExecutor.schedule(() -> {
                if (settled.compareAndSet(false, true)) {
                    closeQuietly(registered);
                    attempt++;
                    dispatchAttempt();
                }
            }, delayNanos(next), TimeUnit.NANOSECONDS));
        } catch (RejectedExecutionException e) {
            if (settled.compareAndSet(false, true)) {
                closeQuietly(registered);
                log.error("Scheduler rejected the delay before attempt {}. Failing execution.", attempt + 1, e);
                fail(e);
            }
            return;
        }
        if (settled.get()) {
            // cancelled while the timer was being armed
            cancelTimer(timer);
        }
    }

    private static long delayNanos(ScheduledDelay delay) {
        try {
            return delay.getDelay().toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void cancelTimer(AtomicReference<ScheduledFuture<?>> timer) {
        ScheduledFuture<?> current = timer.get();
        if (current != null) {
            current.cancel(false);
        }
    }

    private void dispatchAttempt() {
        try {
            taskExecutor.execute(this);
        } catch (RejectedExecutionException e) {
            log.error("Task executor rejected attempt {}. Failing execution.", attempt, e);
            fail(e);
        }
    }

    private void succeed(T value) {
        transition(AttemptState.SUCCEEDED);
        log.debug("Attempt {} succeeded.", attempt);
        result.complete(value);
    }

    private void fail(Throwable error) {
        transition(AttemptState.FAILED);
        result.completeExceptionally(error);
    }

    private void cancel(Object reason, Throwable inFlightError) {
        transition(AttemptState.CANCELLED);
        result.completeExceptionally(new BackoffCancelledException(reason, inFlightError, attemptsStarted.get()));
    }

    private void transition(AttemptState next) {
        log.trace("Backoff execution state {} -> {}", state, next);
        state = next;
    }

    private static void unsubscribe(AtomicReference<CancellationSignal.Subscription> subscription) {
        closeQuietly(subscription.getAndSet(null));
    }

    private static void closeQuietly(CancellationSignal.Subscription subscription) {
        if (subscription != null) {
            subscription.close();
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    AttemptState getState() {
        return state;
    }

    int getAttemptsStarted() {
        return attemptsStarted.get();
    }
}
