package com.scrapequeue.engine;

import com.scrapequeue.core.TaskContext;

/**
 * Hook run before every attempt of a task, after any backoff sleep.
 * The worker uses it to pass rate admission and host pacing per attempt,
 * so retries count against the request budget like first attempts do.
 */
@FunctionalInterface
public interface AttemptGuard {

    /** Guard that only checks for cancellation. */
    AttemptGuard NONE = TaskContext::throwIfCancelled;

    /**
     * Block until the attempt may start.
     *
     * @param context the task's context
     * @throws com.scrapequeue.core.TaskCancelledException if the job was cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    void beforeAttempt(TaskContext context) throws InterruptedException;
}
