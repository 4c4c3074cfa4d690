package com.scrapequeue.core;

/**
 * Outcome of one task after all of its attempts.
 *
 * <p>A result is either a success carrying the task's value or a failure
 * carrying the last error. The raw {@link Throwable} is kept for in-process
 * callers but marked transient so it never ends up in serialized status output;
 * its type and message are copied into plain fields instead.</p>
 *
 * @param <T> the value type
 */
public final class TaskResult<T> {
    private final String taskId;
    private final boolean success;
    private final T value;
    private final String errorType;
    private final String errorMessage;
    private final transient Throwable error;
    private final int attemptCount;
    private final long durationMs;

    private TaskResult(String taskId, boolean success, T value, Throwable error,
                       int attemptCount, long durationMs) {
        this.taskId = taskId;
        this.success = success;
        this.value = value;
        this.error = error;
        this.errorType = error != null ? error.getClass().getSimpleName() : null;
        this.errorMessage = error != null ? error.getMessage() : null;
        this.attemptCount = attemptCount;
        this.durationMs = durationMs;
    }

    public static <T> TaskResult<T> success(String taskId, T value, int attemptCount, long durationMs) {
        return new TaskResult<>(taskId, true, value, null, attemptCount, durationMs);
    }

    public static <T> TaskResult<T> failure(String taskId, Throwable error, int attemptCount, long durationMs) {
        if (error == null) {
            throw new IllegalArgumentException("A failed result needs an error");
        }
        return new TaskResult<>(taskId, false, null, error, attemptCount, durationMs);
    }

    public String getTaskId() {
        return taskId;
    }

    public boolean isSuccess() {
        return success;
    }

    public T getValue() {
        return value;
    }

    public Throwable getError() {
        return error;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Number of attempts actually started. Zero when the task never got a
     * slot (cancelled or timed out while queued).
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * Whether the task was abandoned because its job was cancelled.
     */
    public boolean isCancelled() {
        return error instanceof TaskCancelledException;
    }

    @Override
    public String toString() {
        return "TaskResult{" +
                "taskId='" + taskId + '\'' +
                ", success=" + success +
                (success ? "" : ", error=" + errorType + ": " + errorMessage) +
                ", attempts=" + attemptCount +
                ", durationMs=" + durationMs +
                '}';
    }
}
