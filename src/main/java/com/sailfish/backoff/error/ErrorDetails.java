package com.sailfish.backoff.error;

/**
 * Optional structure an exception can expose to the predicates in {@link ErrorClassifiers}.
 * Every accessor defaults to "absent".
 */
public interface ErrorDetails {

    /**
     * @return A system error code such as {@code ECONNRESET}, or null.
     */
    default String getCode() {
        return null;
    }

    /**
     * @return The HTTP status carried directly by the error, or null.
     */
    default Integer getStatusCode() {
        return null;
    }

    /**
     * @return The HTTP response the error was raised for, or null.
     */
    default ErrorResponse getResponse() {
        return null;
    }
}
