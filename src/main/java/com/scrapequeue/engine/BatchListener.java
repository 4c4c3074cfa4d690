package com.scrapequeue.engine;

import com.scrapequeue.core.TaskResult;

/**
 * Callbacks from the {@link BatchOrchestrator} as a job advances. Called on the
 * orchestrating thread, except {@link #onTaskSettled} which runs on the worker
 * thread that settled the task. Implementations must be quick and must not throw.
 */
public interface BatchListener {

    BatchListener NOOP = new BatchListener() { };

    /**
     * A chunk is about to be dispatched.
     *
     * @param jobId the job
     * @param chunkIndex 0-based chunk number
     * @param chunkSize number of tasks in the chunk
     */
    default void onChunkDispatched(String jobId, int chunkIndex, int chunkSize) {
    }

    /**
     * The orchestrator is about to pause between two chunks.
     *
     * @param jobId the job
     * @param nextChunkIndex the chunk that will follow the pause
     * @param delayMs the pause length
     */
    default void onInterChunkDelay(String jobId, int nextChunkIndex, long delayMs) {
    }

    /**
     * A task of the job settled and its result was recorded.
     *
     * @param jobId the job
     * @param taskIndex the task's position in the job
     * @param result the outcome
     */
    default void onTaskSettled(String jobId, int taskIndex, TaskResult<?> result) {
    }
}
