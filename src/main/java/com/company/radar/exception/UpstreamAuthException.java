package com.company.radar.exception;

/**
 * Stored credentials are missing, invalid, or could not be refreshed.
 * Fatal for the current run; the next scheduled run retries from scratch.
 */
public class UpstreamAuthException extends RuntimeException {
    public UpstreamAuthException(String message) {
        super(message);
    }

    public UpstreamAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
