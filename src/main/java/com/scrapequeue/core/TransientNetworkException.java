package com.scrapequeue.core;

/**
 * Recoverable failure of a unit of work: timeouts, connection resets,
 * server-side hiccups. The scheduler retries these up to the task's limit
 * and only then reports a failed result.
 */
public class TransientNetworkException extends RuntimeException {

    private final int statusCode;

    public TransientNetworkException(String message) {
        this(message, -1, null);
    }

    public TransientNetworkException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    /**
     * @param message the error message
     * @param statusCode the HTTP status that caused the failure, or -1
     * @param cause the underlying cause, may be null
     */
    public TransientNetworkException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status code, or -1 when the failure was not an HTTP response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
