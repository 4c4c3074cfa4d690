package com.scrapequeue.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TerminalValidationException;
import com.scrapequeue.core.TransientNetworkException;

/**
 * Executes a single attempt of a task and waits for it within the task's timeout.
 */
public class AttemptExecutor {
    private static final Logger logger = Logger.getLogger(AttemptExecutor.class.getName());

    /**
     * Start the attempt and wait for its value.
     *
     * @param task the task
     * @param context the task's context, already advanced to this attempt
     * @param timeoutMs how long to wait for the attempt's future
     * @param <T> the value type
     * @return the attempt's value
     * @throws Exception the attempt's own failure, unwrapped from the future;
     *         a {@link TransientNetworkException} if it timed out
     */
    public <T> T execute(Task<T> task, TaskContext context, long timeoutMs) throws Exception {
        logger.fine("Executing task: " + task.getId() + " of type: " + task.getType()
                + " (attempt " + context.getAttempt() + ")");

        long startTime = System.currentTimeMillis();
        CompletableFuture<T> future = task.execute(context);
        if (future == null) {
            throw new TerminalValidationException("Task " + task.getId() + " returned no future");
        }

        try {
            T value = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long duration = System.currentTimeMillis() - startTime;
            logger.fine("Task " + task.getId() + " attempt " + context.getAttempt() + " completed in " + duration + "ms");
            return value;

        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning("Task " + task.getId() + " timed out after " + timeoutMs + "ms");
            throw new TransientNetworkException("Task timed out after " + timeoutMs + "ms", e);

        } catch (ExecutionException e) {
            long duration = System.currentTimeMillis() - startTime;
            Throwable cause = ErrorClassifier.unwrap(e);
            logger.fine("Task " + task.getId() + " attempt " + context.getAttempt() + " failed after "
                    + duration + "ms: " + cause);
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;

        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
