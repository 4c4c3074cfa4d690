package com.scrapequeue.engine;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scrapequeue.config.SchedulerConfig;
import com.scrapequeue.core.RateLimitedException;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TaskResult;

/**
 * Runs one task with bounded, backed-off retries.
 *
 * <p><b>Retry Mechanism:</b></p>
 * <ul>
 *   <li>At most {@code maxRetries + 1} attempts, the task's own limit taking precedence</li>
 *   <li>After attempt n fails, wait {@code min(base * multiplier^(n-1), cap)} plus
 *       a uniform jitter in {@code [0, jitterMs)} before attempt n+1</li>
 *   <li>A rate-limited failure with a retry-after hint waits at least that long and
 *       pauses the shared rate counter for everybody else too</li>
 *   <li>Terminal failures end the task after the attempt that raised them</li>
 * </ul>
 *
 * <p>Never throws: every outcome, including cancellation during a backoff
 * sleep, comes back as a {@link TaskResult}.</p>
 *
 * @see ErrorClassifier
 */
public class RetryCoordinator {
    private static final Logger logger = Logger.getLogger(RetryCoordinator.class.getName());

    private final AttemptExecutor attemptExecutor;
    private final WindowedRateCounter rateCounter;
    private final Clock clock;
    private final long baseDelayMs;
    private final double multiplier;
    private final long delayCapMs;
    private final long jitterMs;
    private final long defaultTimeoutMs;
    private final int defaultMaxRetries;

    /**
     * @param config retry and timeout settings
     * @param rateCounter counter to pause on rate-limited responses, may be null
     * @param clock time source for rate-limit pauses
     */
    public RetryCoordinator(SchedulerConfig config, WindowedRateCounter rateCounter, Clock clock) {
        this(config, rateCounter, clock, new AttemptExecutor());
    }

    RetryCoordinator(SchedulerConfig config, WindowedRateCounter rateCounter, Clock clock,
                     AttemptExecutor attemptExecutor) {
        this.attemptExecutor = attemptExecutor;
        this.rateCounter = rateCounter;
        this.clock = clock;
        this.baseDelayMs = config.getRetryBaseDelayMs();
        this.multiplier = config.getRetryBackoffMultiplier();
        this.delayCapMs = config.getRetryDelayCapMs();
        this.jitterMs = config.getRetryJitterMs();
        this.defaultTimeoutMs = config.getTaskTimeoutMs();
        this.defaultMaxRetries = config.getMaxRetries();
    }

    /**
     * Execute the task until it succeeds, fails terminally or runs out of attempts.
     *
     * @param task the task
     * @param context the task's context (attempt counter starts at 0)
     * @param guard run before every attempt
     * @param <T> the value type
     * @return the final outcome
     */
    public <T> TaskResult<T> execute(Task<T> task, TaskContext context, AttemptGuard guard) {
        long startNanos = System.nanoTime();
        int maxRetries = task.getMaxRetries() >= 0 ? task.getMaxRetries() : defaultMaxRetries;
        int maxAttempts = maxRetries + 1;
        long timeoutMs = task.getTimeoutMillis() > 0 ? task.getTimeoutMillis() : defaultTimeoutMs;
        Throwable lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (attempt > 1) {
                    long delay = retryDelay(attempt - 1, lastError);
                    logger.info("Retrying task " + task.getId() + " in " + delay + "ms (attempt "
                            + attempt + "/" + maxAttempts + ")");
                    context.getCancellation().sleep(delay);
                }
                guard.beforeAttempt(context);
            } catch (TaskCancelledException | SchedulerClosedException e) {
                logger.fine("Task " + task.getId() + " abandoned before attempt " + attempt + ": " + e.getMessage());
                lastError = e;
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = new TaskCancelledException("Task " + task.getId() + " interrupted while waiting to retry");
                break;
            }

            context.nextAttempt();
            try {
                T value = attemptExecutor.execute(task, context, timeoutMs);
                if (attempt > 1) {
                    logger.info("Task " + task.getId() + " succeeded on attempt " + attempt);
                }
                return TaskResult.success(task.getId(), value, context.getAttempt(), elapsedMs(startNanos));

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = e;
                break;

            } catch (Exception e) {
                lastError = ErrorClassifier.unwrap(e);
                if (!ErrorClassifier.isRetryable(lastError)) {
                    logger.warning("Task " + task.getId() + " failed terminally on attempt " + attempt + ": " + lastError);
                    break;
                }
                noteRateLimit(task, lastError);
                if (attempt < maxAttempts) {
                    logger.log(Level.WARNING, "Task " + task.getId() + " attempt " + attempt + "/" + maxAttempts
                            + " failed: " + lastError);
                } else {
                    logger.warning("Task " + task.getId() + " exhausted " + maxAttempts + " attempts: " + lastError);
                }
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Error e) {
                // Linkage and assertion errors from the task end this task only
                logger.log(Level.SEVERE, "Task " + task.getId() + " raised " + e + " on attempt " + attempt, e);
                lastError = e;
                break;
            }
        }

        return TaskResult.failure(task.getId(), lastError, context.getAttempt(), elapsedMs(startNanos));
    }

    /**
     * Backoff before the next attempt without jitter.
     *
     * @param failedAttempts number of attempts made so far (n), at least 1
     * @return {@code min(base * multiplier^(n-1), cap)}
     */
    public long backoffDelay(int failedAttempts) {
        double raw = baseDelayMs * Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        return (long) Math.min(raw, (double) delayCapMs);
    }

    private long retryDelay(int failedAttempts, Throwable lastError) {
        long delay = backoffDelay(failedAttempts);
        if (jitterMs > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitterMs);
        }
        if (lastError instanceof RateLimitedException) {
            delay = Math.max(delay, ((RateLimitedException) lastError).getRetryAfterMillis());
        }
        return delay;
    }

    private void noteRateLimit(Task<?> task, Throwable error) {
        if (!ErrorClassifier.isRateLimited(error)) {
            return;
        }
        long retryAfter = error instanceof RateLimitedException
                ? ((RateLimitedException) error).getRetryAfterMillis() : 0L;
        logger.warning("Rate limit detected for task " + task.getId()
                + (task.getHost() != null ? " (" + task.getHost() + ")" : ""));
        if (retryAfter > 0 && rateCounter != null) {
            rateCounter.pauseUntil(clock.millis() + retryAfter);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
