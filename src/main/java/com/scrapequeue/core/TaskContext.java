package com.scrapequeue.core;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Context information for one task execution.
 *
 * <p>This class serves as the bridge between a task's own logic and the scheduler.
 * It provides:</p>
 * <ul>
 *   <li>Identity: task id, owning job id and the current attempt number</li>
 *   <li>Cancellation checking via the job's {@link CancellationSignal}</li>
 *   <li>Task-scoped logging</li>
 * </ul>
 *
 * <p>One context is created per task and reused across its attempts; the
 * scheduler advances the attempt counter before each attempt.</p>
 *
 * @see Task#execute(TaskContext)
 */
public class TaskContext {
    private static final Logger logger = Logger.getLogger(TaskContext.class.getName());

    private final String taskId;
    private final String jobId;
    private final CancellationSignal cancellation;
    private volatile int attempt;

    /**
     * Create a new context for a task.
     *
     * @param taskId the task being executed
     * @param jobId the owning job, or null for a standalone task
     * @param cancellation the owning job's cancellation signal
     */
    public TaskContext(String taskId, String jobId, CancellationSignal cancellation) {
        this.taskId = taskId;
        this.jobId = jobId;
        this.cancellation = cancellation == null ? CancellationSignal.NONE : cancellation;
        this.attempt = 0;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * Get the 1-based number of the attempt currently running.
     *
     * @return the attempt number, 0 before the first attempt
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Advance to the next attempt. Called by the scheduler only.
     *
     * @return the new attempt number
     */
    public int nextAttempt() {
        return ++attempt;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    /**
     * Check if the owning job has been cancelled.
     *
     * @return true if cancelled
     */
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Throw if the owning job has been cancelled. Long-running tasks may call
     * this between steps; the scheduler never forces an in-flight attempt to stop.
     *
     * @throws TaskCancelledException if cancelled
     */
    public void throwIfCancelled() {
        cancellation.throwIfCancelled();
    }

    /**
     * Log a task-scoped message.
     *
     * @param level the log level
     * @param message the message
     */
    public void log(Level level, String message) {
        if (logger.isLoggable(level)) {
            logger.log(level, "[" + taskId + (jobId != null ? "@" + jobId : "") + " #" + attempt + "] " + message);
        }
    }

    @Override
    public String toString() {
        return "TaskContext{" +
                "taskId='" + taskId + '\'' +
                ", jobId='" + jobId + '\'' +
                ", attempt=" + attempt +
                ", cancelled=" + cancellation.isCancelled() +
                '}';
    }
}
