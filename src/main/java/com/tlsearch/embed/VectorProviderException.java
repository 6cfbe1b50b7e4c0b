package com.tlsearch.embed;

import java.io.IOException;

/**
 * Failure talking to the embedding provider. {@code status} is -1 when no HTTP response was received.
 */
public class VectorProviderException extends IOException {
    public static final int NO_STATUS = -1;

    private final int status;
    private final String responseBody;
    private final boolean retryable;

    public VectorProviderException(String message, int status, String responseBody, boolean retryable, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody == null ? "" : responseBody;
        this.retryable = retryable;
    }

    public static VectorProviderException httpError(int status, String reason, String responseBody) {
        boolean retryable = status >= 500 || status == 429;
        String message = "Embedding provider error: %d %s - %s".formatted(status, reason == null ? "" : reason, responseBody);
        return new VectorProviderException(message, status, responseBody, retryable, null);
    }

    public static VectorProviderException transport(IOException cause) {
        return new VectorProviderException("Embedding provider unreachable: " + cause.getMessage(), NO_STATUS, "", true, cause);
    }

    public static VectorProviderException malformed(String detail) {
        return new VectorProviderException("Embedding provider returned an unusable response: " + detail, NO_STATUS, "", false, null);
    }

    public int status() {
        return status;
    }

    public String responseBody() {
        return responseBody;
    }

    public boolean retryable() {
        return retryable;
    }
}
