package com.scrapequeue.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.core.TaskResult;
import com.scrapequeue.registry.JobRecord;
import com.scrapequeue.registry.JobSnapshot;

/**
 * Drives the tasks of one job to completion chunk by chunk.
 *
 * <p><b>Algorithm:</b></p>
 * <ol>
 *   <li>Read the current concurrency ceiling from the {@link AdaptiveThrottle}
 *       (it may have moved since the previous chunk) and cut the next chunk:
 *       {@code min(batchSize, ceiling)} tasks, or {@code ceiling} when no batch
 *       size is configured</li>
 *   <li>Dispatch every task of the chunk in parallel, each through a {@link Worker}</li>
 *   <li>Record each result in the job as soon as that task settles</li>
 *   <li>Wait for every task of the chunk; failures never cut a chunk short</li>
 *   <li>Pause {@code delayBetweenBatchesMs} unless this was the last chunk or
 *       the job was cancelled</li>
 * </ol>
 *
 * <p>Chunk N+1 never starts before chunk N has fully settled. Cancellation stops
 * the loop before the next dispatch and cuts the pause short.</p>
 */
public class BatchOrchestrator {
    private static final Logger logger = Logger.getLogger(BatchOrchestrator.class.getName());

    private final ExecutorService workerPool;
    private final ExecutionPipeline pipeline;
    private final int batchSize;
    private final long delayBetweenBatchesMs;
    private final BatchListener listener;

    BatchOrchestrator(ExecutorService workerPool, ExecutionPipeline pipeline, int batchSize,
                      long delayBetweenBatchesMs, BatchListener listener) {
        this.workerPool = workerPool;
        this.pipeline = pipeline;
        this.batchSize = batchSize;
        this.delayBetweenBatchesMs = delayBetweenBatchesMs;
        this.listener = listener == null ? BatchListener.NOOP : listener;
    }

    /**
     * Run all tasks of the job on the calling thread's watch and finish the job.
     *
     * @param job the job, pending
     * @param tasks the tasks, in job order; size must match the job
     * @param <T> the task value type
     * @return the job's final snapshot
     */
    public <T> JobSnapshot run(JobRecord job, List<? extends Task<T>> tasks) {
        if (tasks.size() != job.getTotalTasks()) {
            throw new IllegalArgumentException("Job " + job.getId() + " expects " + job.getTotalTasks()
                    + " tasks, got " + tasks.size());
        }
        String jobId = job.getId();
        try {
            int next = 0;
            int chunkIndex = 0;
            while (next < tasks.size()) {
                if (job.isCancelled()) {
                    break;
                }
                if (pipeline.gate.isClosed()) {
                    throw new SchedulerClosedException("Scheduler shut down with " + (tasks.size() - next)
                            + " tasks of job " + jobId + " not dispatched");
                }
                if (!job.markRunning()) {
                    break;
                }

                int end = Math.min(tasks.size(), next + currentChunkSize());
                logger.fine("Job " + jobId + " dispatching chunk " + chunkIndex + " (tasks " + next + "-" + (end - 1) + ")");
                listener.onChunkDispatched(jobId, chunkIndex, end - next);
                dispatchChunk(job, tasks, next, end);
                next = end;
                chunkIndex++;

                if (next < tasks.size() && !job.isCancelled()) {
                    listener.onInterChunkDelay(jobId, chunkIndex, delayBetweenBatchesMs);
                    job.getCancellation().sleep(delayBetweenBatchesMs);
                }
            }
            if (!job.isCancelled()) {
                job.complete();
            }

        } catch (TaskCancelledException e) {
            logger.info("Job " + jobId + " stopped: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.fail("Interrupted while running");
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Job " + jobId + " failed", e);
            job.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        JobSnapshot snapshot = job.snapshot();
        logger.info("Job " + jobId + " finished as " + snapshot.getStatus() + ": " + snapshot.getSummary());
        return snapshot;
    }

    /**
     * Size of the next chunk given the throttle's current ceiling.
     */
    int currentChunkSize() {
        int ceiling = Math.max(1, pipeline.throttle.getCurrentConcurrencyLimit());
        return batchSize > 0 ? Math.min(batchSize, ceiling) : ceiling;
    }

    private <T> void dispatchChunk(JobRecord job, List<? extends Task<T>> tasks, int start, int end)
            throws InterruptedException {
        List<CompletableFuture<Void>> settled = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            final int index = i;
            Worker<T> worker = new Worker<>(tasks.get(i), job.getId(), job.getCancellation(), pipeline);
            settled.add(CompletableFuture.supplyAsync(worker::call, workerPool)
                    .thenAccept(result -> onSettled(job, index, result)));
        }
        try {
            CompletableFuture.allOf(settled.toArray(new CompletableFuture<?>[0])).get();
        } catch (ExecutionException e) {
            // Worker.call() only lets a VirtualMachineError through; that or a listener bug gets here
            throw new IllegalStateException("Chunk of job " + job.getId() + " did not settle cleanly",
                    ErrorClassifier.unwrap(e));
        }
    }

    private void onSettled(JobRecord job, int index, TaskResult<?> result) {
        if (job.recordResult(index, result)) {
            listener.onTaskSettled(job.getId(), index, result);
        }
    }
}
