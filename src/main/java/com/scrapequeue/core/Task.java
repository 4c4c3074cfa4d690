package com.scrapequeue.core;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Task interface representing one unit of work handed to the scheduler.
 * The scheduler treats a task as a black box: it only starts it, waits for
 * the returned future and decides whether a failure deserves another attempt.
 *
 * @param <T> the type of value produced by a successful execution
 */
public interface Task<T> {

    /**
     * Get the unique identifier for this task.
     * The ID is a UUID string unless the caller supplies its own opaque id.
     *
     * @return the task's unique identifier
     */
    String getId();

    /**
     * Get the type of this task, typically the simple class name
     * (e.g., "PageFetchTask"). Used for logging and status reporting.
     *
     * @return the task type
     */
    String getType();

    /**
     * Start one attempt of the unit of work.
     * Implementations must be safe to call again for a retry; each call
     * starts a fresh attempt and returns a fresh future.
     *
     * <p>Failures may be reported either by throwing from this method or by
     * completing the returned future exceptionally. Throw
     * {@link TerminalValidationException} for input that will never succeed,
     * {@link TransientNetworkException} for failures worth retrying.</p>
     *
     * @param context the attempt context (ids, attempt number, cancellation)
     * @return a future completed with the attempt's value
     * @throws Exception if the attempt cannot be started
     */
    CompletableFuture<T> execute(TaskContext context) throws Exception;

    /**
     * Get the maximum number of retries allowed after the first attempt.
     * A task is executed at most {@code getMaxRetries() + 1} times.
     *
     * @return the maximum number of retries (0 means a single attempt), or a negative
     *         value to use the scheduler's {@code maxRetries}
     */
    int getMaxRetries();

    /**
     * Get the time this task was created by its caller.
     *
     * @return the submission instant
     */
    Instant getSubmittedAt();

    /**
     * Get the per-attempt operation timeout. A value of zero or less means
     * the scheduler's configured default applies.
     *
     * @return timeout in milliseconds, or 0 for the default
     */
    default long getTimeoutMillis() {
        return 0L;
    }

    /**
     * Get the host this task talks to, used to space out requests to the
     * same site. {@code null} disables host pacing for this task.
     *
     * @return the host name, or null
     */
    default String getHost() {
        return null;
    }
}
