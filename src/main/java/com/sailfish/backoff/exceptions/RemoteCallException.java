package com.sailfish.backoff.exceptions;

import com.sailfish.backoff.error.ErrorDetails;
import com.sailfish.backoff.error.ErrorResponse;

/**
 * General-purpose failure of a remote call, carrying the structure the built-in retryability
 * predicates look at.
 */
public class RemoteCallException extends RuntimeException implements ErrorDetails {

    private static final long serialVersionUID = 1L;

    private final String code;
    private final Integer statusCode;
    private final ErrorResponse response;

    protected RemoteCallException(Builder builder) {
        super(builder.message, builder.cause);
        this.code = builder.code;
        this.statusCode = builder.statusCode;
        this.response = builder.response;
    }

    public static Builder builder(String message) {
        return new Builder(message);
    }

    @Override
    public String getCode() {
        return code;
    }

    @Override
    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public ErrorResponse getResponse() {
        return response;
    }

    public static class Builder {

        private final String message;
        private String code;
        private Integer statusCode;
        private ErrorResponse response;
        private Throwable cause;

        protected Builder(String message) {
            this.message = message;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder statusCode(Integer statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder response(ErrorResponse response) {
            this.response = response;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public RemoteCallException build() {
            return new RemoteCallException(this);
        }
    }
}
