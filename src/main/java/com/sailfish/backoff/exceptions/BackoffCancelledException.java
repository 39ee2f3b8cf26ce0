package com.sailfish.backoff.exceptions;

/**
 * Raised when a backoff execution stops because its cancellation signal fired.
 *
 * Distinct from any error of the retried operation: the operation's own failures are always
 * surfaced unchanged. When cancellation interrupted a delay, the error that triggered that retry
 * is attached as the cause.
 */
public class BackoffCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object reason;
    private final int attemptsStarted;

    public BackoffCancelledException(Object reason, Throwable inFlightError, int attemptsStarted) {
        super(String.valueOf(reason), inFlightError);
        this.reason = reason;
        this.attemptsStarted = attemptsStarted;
    }

    /**
     * @return The reason passed to {@code CancellationSignal#cancel(Object)}, unchanged.
     */
    public Object getReason() {
        return reason;
    }

    /**
     * @return How many attempts had been started when cancellation won.
     */
    public int getAttemptsStarted() {
        return attemptsStarted;
    }

    /**
     * @return Whether the operation had been invoked at all.
     */
    public boolean isOperationStarted() {
        return attemptsStarted > 0;
    }
}
