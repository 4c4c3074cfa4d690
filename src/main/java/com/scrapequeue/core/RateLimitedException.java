package com.scrapequeue.core;

/**
 * The remote site answered with a rate-limit response (429, 503, "too many requests").
 *
 * <p>Retryable like any transient failure. When the site sent a retry-after hint
 * the scheduler additionally stops admitting new requests until it has elapsed.</p>
 */
public class RateLimitedException extends TransientNetworkException {

    private final long retryAfterMillis;

    public RateLimitedException(String message, int statusCode) {
        this(message, statusCode, 0L);
    }

    /**
     * @param message the error message
     * @param statusCode the HTTP status of the response
     * @param retryAfterMillis how long the site asked us to wait, 0 if it gave no hint
     */
    public RateLimitedException(String message, int statusCode, long retryAfterMillis) {
        super(message, statusCode, null);
        this.retryAfterMillis = Math.max(0L, retryAfterMillis);
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
