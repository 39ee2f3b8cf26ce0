package com.sailfish.backoff.error;

import java.util.Objects;

/**
 * Minimal view of an HTTP response attached to an error. Clients disagree on the field name, so
 * both {@code status} and {@code statusCode} are kept.
 */
public final class ErrorResponse {

    private final Integer status;
    private final Integer statusCode;

    public ErrorResponse(Integer status, Integer statusCode) {
        this.status = status;
        this.statusCode = statusCode;
    }

    public static ErrorResponse ofStatus(int status) {
        return new ErrorResponse(status, null);
    }

    public Integer getStatus() { return status; }
    public Integer getStatusCode() { return statusCode; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorResponse that = (ErrorResponse) o;
        return Objects.equals(status, that.status) && Objects.equals(statusCode, that.statusCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, statusCode);
    }

    @Override
    public String toString() {
        return "ErrorResponse{status=" + status + ", statusCode=" + statusCode + "}";
    }
}
