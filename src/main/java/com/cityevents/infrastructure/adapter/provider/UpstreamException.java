package com.cityevents.infrastructure.adapter.provider;

/**
 * Raised when the discovery provider cannot be reached or answers with a status other than
 * success or 401.
 */
public class UpstreamException extends RuntimeException {

    private final int status;

    public UpstreamException(String message, int status) {
        super(message);
        this.status = status;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int status() {
        return status;
    }
}
