package com.sailfish.backoff.error;

import com.sailfish.backoff.exceptions.RemoteCallException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifiersTest {

    @Nested
    @DisplayName("isNetworkError")
    class NetworkError {

        @Test
        @DisplayName("Matches a known code on the nested cause")
        void nestedCauseCode() {
            RemoteCallException cause = RemoteCallException.builder("reset").code("ECONNRESET").build();
            RemoteCallException error = RemoteCallException.builder("request failed").cause(cause).build();

            assertThat(ErrorClassifiers.isNetworkError(error)).isTrue();
        }

        @Test
        @DisplayName("Matches a known code on the error itself")
        void ownCode() {
            assertThat(ErrorClassifiers.isNetworkError(RemoteCallException.builder("dns").code("EAI_AGAIN").build())).isTrue();
        }

        @Test
        @DisplayName("Ignores a server status without a code")
        void statusWithoutCode() {
            RemoteCallException error = RemoteCallException.builder("unavailable").statusCode(503).build();

            assertThat(ErrorClassifiers.isNetworkError(error)).isFalse();
        }

        @Test
        @DisplayName("Prefers the cause's code over the error's own code")
        void causeCodeWins() {
            RemoteCallException cause = RemoteCallException.builder("bad input").code("EINVAL").build();
            RemoteCallException error = RemoteCallException.builder("wrapped").code("ECONNRESET").cause(cause).build();

            assertThat(ErrorClassifiers.isNetworkError(error)).isFalse();
        }

        @Test
        @DisplayName("Falls back to the own code when the cause has none")
        void ownCodeWhenCauseHasNone() {
            RemoteCallException error = RemoteCallException.builder("wrapped")
                    .code("ETIMEDOUT")
                    .cause(new IllegalStateException("no code"))
                    .build();

            assertThat(ErrorClassifiers.isNetworkError(error)).isTrue();
        }

        @Test
        @DisplayName("Rejects unknown codes and plain exceptions")
        void unknownCodes() {
            assertThat(ErrorClassifiers.isNetworkError(RemoteCallException.builder("x").code("EACCES").build())).isFalse();
            assertThat(ErrorClassifiers.isNetworkError(new RuntimeException("ECONNRESET"))).isFalse();
            assertThat(ErrorClassifiers.isNetworkError(null)).isFalse();
        }

        @Test
        @DisplayName("Maps JDK network exceptions to their codes")
        void jdkExceptions() {
            assertThat(ErrorClassifiers.isNetworkError(new ConnectException("Connection refused"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new UnknownHostException("example.invalid"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new SocketTimeoutException("Read timed out"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new HttpTimeoutException("request timed out"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new SocketException("Connection reset"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new SocketException("Broken pipe (Write failed)"))).isTrue();
            assertThat(ErrorClassifiers.isNetworkError(new SocketException("Socket closed"))).isFalse();
            assertThat(ErrorClassifiers.isNetworkError(new IOException("disk full"))).isFalse();
        }

        @Test
        @DisplayName("Sees a JDK network exception through a wrapper")
        void wrappedJdkException() {
            RuntimeException wrapper = new RuntimeException("call failed", new ConnectException("Connection refused"));

            assertThat(ErrorClassifiers.codeOf(wrapper)).isEqualTo("ECONNREFUSED");
            assertThat(ErrorClassifiers.isNetworkError(wrapper)).isTrue();
        }
    }

    @Nested
    @DisplayName("isInternalServerError")
    class InternalServerError {

        @Test
        @DisplayName("Matches a 5xx status on the nested response")
        void nestedResponseStatus() {
            RemoteCallException error = RemoteCallException.builder("bad gateway")
                    .response(ErrorResponse.ofStatus(503))
                    .build();

            assertThat(ErrorClassifiers.isInternalServerError(error)).isTrue();
        }

        @Test
        @DisplayName("Matches the response statusCode field too")
        void nestedResponseStatusCode() {
            RemoteCallException error = RemoteCallException.builder("oops")
                    .response(new ErrorResponse(null, 500))
                    .build();

            assertThat(ErrorClassifiers.isInternalServerError(error)).isTrue();
        }

        @Test
        @DisplayName("Rejects client errors")
        void clientError() {
            assertThat(ErrorClassifiers.isInternalServerError(RemoteCallException.builder("nf").statusCode(404).build())).isFalse();
            assertThat(ErrorClassifiers.isInternalServerError(
                    RemoteCallException.builder("nf").response(ErrorResponse.ofStatus(404)).build())).isFalse();
        }

        @Test
        @DisplayName("Own status takes precedence over the response")
        void ownStatusFirst() {
            RemoteCallException error = RemoteCallException.builder("mixed")
                    .statusCode(404)
                    .response(ErrorResponse.ofStatus(502))
                    .build();

            assertThat(ErrorClassifiers.isInternalServerError(error)).isFalse();
        }

        @Test
        @DisplayName("A zero status counts as absent")
        void zeroStatusIsSkipped() {
            RemoteCallException error = RemoteCallException.builder("mixed")
                    .statusCode(0)
                    .response(ErrorResponse.ofStatus(504))
                    .build();

            assertThat(ErrorClassifiers.isInternalServerError(error)).isTrue();
        }

        @Test
        @DisplayName("Errors without structure never match")
        void unstructuredErrors() {
            assertThat(ErrorClassifiers.isInternalServerError(new RuntimeException("500"))).isFalse();
            assertThat(ErrorClassifiers.isInternalServerError(RemoteCallException.builder("none").build())).isFalse();
            assertThat(ErrorClassifiers.isInternalServerError(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("isConnectionErrorMessage")
    class ConnectionErrorMessage {

        @Test
        @DisplayName("Matches known phrases anywhere in the message")
        void knownPhrases() {
            assertThat(ErrorClassifiers.isConnectionErrorMessage(new RuntimeException("request failed: socket hang up"))).isTrue();
            assertThat(ErrorClassifiers.isConnectionErrorMessage(new RuntimeException("connect ECONNREFUSED 127.0.0.1:80"))).isTrue();
            assertThat(ErrorClassifiers.isConnectionErrorMessage(
                    new RuntimeException("SocksClient internal error (this should not happen)"))).isTrue();
        }

        @Test
        @DisplayName("Treats phrases literally, not as patterns")
        void phrasesAreLiteral() {
            assertThat(ErrorClassifiers.isConnectionErrorMessage(
                    new RuntimeException("SocksClient internal error xthis should not happenx"))).isFalse();
        }

        @Test
        @DisplayName("Is case-sensitive")
        void caseSensitive() {
            assertThat(ErrorClassifiers.isConnectionErrorMessage(new RuntimeException("Socket Hang Up"))).isFalse();
        }

        @Test
        @DisplayName("Missing messages never match")
        void missingMessage() {
            assertThat(ErrorClassifiers.isConnectionErrorMessage(new RuntimeException())).isFalse();
            assertThat(ErrorClassifiers.isConnectionErrorMessage(null)).isFalse();
        }
    }
}
