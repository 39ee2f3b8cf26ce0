package com.sailfish.backoff.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ready-made retryability predicates for transient failures of remote calls.
 * All of them are pure and return false for a null error.
 */
public final class ErrorClassifiers {

    public static final Set<String> NETWORK_ERROR_CODES = Set.of(
            "ECONNRESET",   // connection reset by peer
            "ENOTFOUND",    // DNS lookup failed
            "ETIMEDOUT",
            "EPIPE",        // broken pipe
            "ENETUNREACH",
            "ECONNABORTED",
            "ECONNREFUSED",
            "ENETDOWN",
            "ENETRESET",    // connection aborted by the network
            "EALREADY",     // connection already in progress on the socket
            "EAI_AGAIN",    // DNS lookup temporarily failed
            "EHOSTUNREACH");

    public static final List<String> RETRYABLE_ERROR_MESSAGES = List.of(
            "ECONNREFUSED",
            "ConnectionRefused",
            "SocksClient internal error (this should not happen)",
            "Client network socket disconnected before secure TLS connection was established",
            "Received invalid Socks5 initial handshake (invalid socks version)",
            "socket hang up",
            "Socks5 proxy rejected connection - ConnectionRefused");

    private static final Pattern RETRYABLE_MESSAGE_PATTERN = Pattern.compile(
            RETRYABLE_ERROR_MESSAGES.stream()
                    .map(message -> "(" + Pattern.quote(message) + ")")
                    .collect(Collectors.joining("|")));

    private ErrorClassifiers() {
    }

    /**
     * True when the error code is a known network failure code. The code of the error's direct
     * cause takes precedence over the error's own code. Besides {@link ErrorDetails#getCode()},
     * JDK network exceptions are mapped to their equivalent codes, e.g. {@link ConnectException}
     * to {@code ECONNREFUSED}.
     */
    public static boolean isNetworkError(Throwable error) {
        if (error == null) {
            return false;
        }
        String code = codeOf(error);
        return code != null && NETWORK_ERROR_CODES.contains(code);
    }

    /**
     * True when the HTTP status is 500 or above. The status is the first non-zero of the error's
     * own status code, its response's {@code statusCode} and its response's {@code status}.
     */
    public static boolean isInternalServerError(Throwable error) {
        if (!(error instanceof ErrorDetails)) {
            return false;
        }
        Integer status = statusOf((ErrorDetails) error);
        return status != null && status >= 500;
    }

    /**
     * True when the error message contains one of {@link #RETRYABLE_ERROR_MESSAGES}. Case-sensitive.
     */
    public static boolean isConnectionErrorMessage(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return false;
        }
        return RETRYABLE_MESSAGE_PATTERN.matcher(error.getMessage()).find();
    }

    static String codeOf(Throwable error) {
        Throwable cause = error.getCause();
        String causeCode = cause != null && cause != error ? ownCodeOf(cause) : null;
        return causeCode != null ? causeCode : ownCodeOf(error);
    }

    private static String ownCodeOf(Throwable error) {
        if (error instanceof ErrorDetails) {
            String code = ((ErrorDetails) error).getCode();
            if (code != null) {
                return code;
            }
        }
        return jdkCodeOf(error);
    }

    private static String jdkCodeOf(Throwable error) {
        if (error instanceof ConnectException) return "ECONNREFUSED";
        if (error instanceof NoRouteToHostException) return "EHOSTUNREACH";
        if (error instanceof UnknownHostException) return "ENOTFOUND";
        if (error instanceof SocketTimeoutException || error instanceof HttpTimeoutException) return "ETIMEDOUT";
        if (error instanceof SocketException && error.getMessage() != null) {
            String message = error.getMessage();
            if (message.contains("Connection reset")) return "ECONNRESET";
            if (message.contains("Broken pipe")) return "EPIPE";
            if (message.contains("Network is unreachable")) return "ENETUNREACH";
            if (message.contains("Connection aborted")) return "ECONNABORTED";
        }
        return null;
    }

    private static Integer statusOf(ErrorDetails details) {
        Integer status = details.getStatusCode();
        if (isPresent(status)) {
            return status;
        }
        ErrorResponse response = details.getResponse();
        if (response == null) {
            return null;
        }
        if (isPresent(response.getStatusCode())) {
            return response.getStatusCode();
        }
        return isPresent(response.getStatus()) ? response.getStatus() : null;
    }

    private static boolean isPresent(Integer status) {
        return status != null && status != 0;
    }
}
