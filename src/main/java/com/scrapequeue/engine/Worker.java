package com.scrapequeue.engine;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.QueueOverloadException;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TaskResult;

/**
 * Worker that carries a single task through the scheduler on a pool thread.
 *
 * <p>Each Worker handles the complete lifecycle of one task:</p>
 * <ul>
 *   <li>Acquire a concurrency slot (bounded wait, abandoned on cancellation)</li>
 *   <li>Sleep the throttle's current per-task delay</li>
 *   <li>Before every attempt: wait for rate admission and the host's turn</li>
 *   <li>Execute with retries through the {@link RetryCoordinator}</li>
 *   <li>Release the slot exactly once, on every path</li>
 *   <li>Feed the outcome to the {@link AdaptiveThrottle} and the statistics</li>
 * </ul>
 *
 * <p><b>Error Handling Strategy:</b> nothing escapes {@link #call()}. A task that
 * could not get a slot, was cancelled, or hit an unexpected scheduler fault is
 * reported as a failed {@link TaskResult}, so one bad task never takes its
 * batch down with it.</p>
 *
 * @see BatchOrchestrator
 */
public class Worker<T> implements Callable<TaskResult<T>> {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final Task<T> task;
    private final String jobId;
    private final CancellationSignal cancellation;
    private final ExecutionPipeline pipeline;

    Worker(Task<T> task, String jobId, CancellationSignal cancellation, ExecutionPipeline pipeline) {
        this.task = task;
        this.jobId = jobId;
        this.cancellation = cancellation == null ? CancellationSignal.NONE : cancellation;
        this.pipeline = pipeline;
    }

    @Override
    public TaskResult<T> call() {
        String taskId = task.getId();
        long startNanos = System.nanoTime();
        TaskContext context = new TaskContext(taskId, jobId, cancellation);

        // === ADMISSION ===
        ConcurrencySlot slot;
        try {
            slot = pipeline.gate.acquire(cancellation, pipeline.slotWaitTimeoutMs);
            pipeline.stats.recordWait(elapsedMs(startNanos));
        } catch (TaskCancelledException | SchedulerClosedException e) {
            logger.fine("Task " + taskId + " not started: " + e.getMessage());
            return settle(TaskResult.failure(taskId, e, 0, elapsedMs(startNanos)));
        } catch (QueueOverloadException e) {
            logger.severe("Task " + taskId + " gave up waiting for a slot: " + e.getMessage()
                    + " (" + e.getQueuedCount() + " queued, capacity " + e.getCapacity() + ")");
            return settle(TaskResult.failure(taskId, e, 0, elapsedMs(startNanos)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return settle(TaskResult.failure(taskId,
                    new TaskCancelledException("Task " + taskId + " interrupted while waiting for a slot"),
                    0, elapsedMs(startNanos)));
        }

        // === EXECUTION ===
        TaskResult<T> result;
        try {
            cancellation.sleep(pipeline.throttle.getCurrentDelayMs());
            result = pipeline.retryCoordinator.execute(task, context, this::awaitTurn);
        } catch (TaskCancelledException e) {
            result = TaskResult.failure(taskId, e, context.getAttempt(), elapsedMs(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = TaskResult.failure(taskId,
                    new TaskCancelledException("Task " + taskId + " interrupted before its first attempt"),
                    context.getAttempt(), elapsedMs(startNanos));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            // Scheduler fault, not a task failure: report it on this task only
            logger.log(Level.SEVERE, "Unexpected error while running task " + taskId, e);
            result = TaskResult.failure(taskId, e, context.getAttempt(), elapsedMs(startNanos));
        } finally {
            slot.release();
        }

        // === FEEDBACK ===
        if (result.getAttemptCount() > 0 && !result.isCancelled()) {
            pipeline.throttle.recordOutcome(result.isSuccess());
        }
        return settle(result);
    }

    private void awaitTurn(TaskContext context) throws InterruptedException {
        pipeline.rateCounter.awaitAdmission(context.getCancellation());
        pipeline.hostLimiter.awaitTurn(task.getHost(), context.getCancellation());
    }

    private TaskResult<T> settle(TaskResult<T> result) {
        pipeline.stats.record(result);
        if (result.isSuccess()) {
            logger.fine("Task " + task.getId() + " succeeded after " + result.getAttemptCount() + " attempt(s)");
        } else if (!result.isCancelled()) {
            logger.info("Task " + task.getId() + " failed after " + result.getAttemptCount() + " attempt(s): "
                    + result.getErrorType() + ": " + result.getErrorMessage());
        }
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
