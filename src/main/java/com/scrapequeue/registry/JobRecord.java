package com.scrapequeue.registry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.JobStatus;
import com.scrapequeue.core.TaskResult;

/**
 * Live state of one batch or bulk job.
 *
 * <p><b>Key Invariants:</b></p>
 * <ul>
 *   <li>Status follows {@link JobStatus#canTransitionTo(JobStatus)}; a terminal
 *       status is reached exactly once</li>
 *   <li>Progress never decreases</li>
 *   <li>No result is recorded after the job is terminal; results of tasks that
 *       were still in flight when the job was cancelled are discarded</li>
 *   <li>Each task position is recorded at most once</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> state is guarded by the instance monitor. The
 * cancellation signal is fired outside the monitor because its listeners take
 * other locks (the concurrency gate's).</p>
 */
public class JobRecord {
    private static final Logger logger = Logger.getLogger(JobRecord.class.getName());

    private final String id;
    private final String label;
    private final int totalTasks;
    private final Instant createdAt;
    private final Clock clock;
    private final CancellationSignal cancellation;
    private final CountDownLatch finished = new CountDownLatch(1);

    private JobStatus status = JobStatus.PENDING;
    private final TaskResult<?>[] results;
    private int settled;
    private int progress;
    private Instant startedAt;
    private Instant endedAt;
    private String error;

    JobRecord(String id, String label, int totalTasks, Clock clock) {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("totalTasks must be >= 0");
        }
        this.id = id;
        this.label = label;
        this.totalTasks = totalTasks;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.cancellation = new CancellationSignal("Job " + id);
        this.results = new TaskResult<?>[totalTasks];
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getProgress() {
        return progress;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Move PENDING → RUNNING on first dispatch. No-op when already running.
     *
     * @return true if the job is running after the call
     */
    public synchronized boolean markRunning() {
        if (status == JobStatus.RUNNING) {
            return true;
        }
        if (!status.canTransitionTo(JobStatus.RUNNING)) {
            return false;
        }
        status = JobStatus.RUNNING;
        startedAt = clock.instant();
        logger.info("Job " + id + " running (" + totalTasks + " tasks)");
        return true;
    }

    /**
     * Record the result of the task at {@code index} and advance progress.
     *
     * @param index the task's position in the submitted sequence
     * @param result its outcome
     * @return false if the result was discarded (job terminal or position already recorded)
     */
    public synchronized boolean recordResult(int index, TaskResult<?> result) {
        if (index < 0 || index >= totalTasks) {
            throw new IndexOutOfBoundsException("Task index " + index + " outside job of " + totalTasks);
        }
        if (status.isTerminal()) {
            logger.fine("Job " + id + " is " + status + "; discarding result of " + result.getTaskId());
            return false;
        }
        if (results[index] != null) {
            logger.warning("Job " + id + " already has a result at position " + index + "; discarding duplicate");
            return false;
        }
        results[index] = result;
        settled++;
        int newProgress = (int) ((settled * 100L) / totalTasks);
        if (newProgress > progress) {
            progress = newProgress;
        }
        return true;
    }

    /**
     * Finish the job successfully (all chunks settled).
     *
     * @return true if this call moved the job to COMPLETED
     */
    public boolean complete() {
        synchronized (this) {
            if (totalTasks == 0 && status == JobStatus.PENDING) {
                status = JobStatus.RUNNING;
                startedAt = clock.instant();
            }
            if (!transitionTo(JobStatus.COMPLETED)) {
                return false;
            }
            progress = 100;
        }
        finished.countDown();
        return true;
    }

    /**
     * Finish the job as failed because the orchestration broke. Tasks still
     * waiting are abandoned as on cancellation.
     *
     * @param message what went wrong
     * @return true if this call moved the job to FAILED
     */
    public boolean fail(String message) {
        synchronized (this) {
            if (!transitionTo(JobStatus.FAILED)) {
                return false;
            }
            error = message;
        }
        cancellation.cancel();
        finished.countDown();
        return true;
    }

    /**
     * Cancel the job cooperatively: no new chunk is dispatched, waiting tasks
     * are abandoned, in-flight attempts finish on their own.
     *
     * @return true if this call cancelled the job, false if it was already terminal
     */
    public boolean cancel() {
        synchronized (this) {
            if (!transitionTo(JobStatus.CANCELLED)) {
                return false;
            }
            error = "Cancelled by request";
        }
        cancellation.cancel();
        finished.countDown();
        return true;
    }

    // caller holds the monitor
    private boolean transitionTo(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            logger.fine("Job " + id + " ignoring transition " + status + " -> " + target);
            return false;
        }
        logger.info("Job " + id + " " + status + " -> " + target + " (" + settled + "/" + totalTasks + " settled)");
        status = target;
        endedAt = clock.instant();
        return true;
    }

    /**
     * Wait until the job reaches a terminal status.
     *
     * @param timeout how long to wait
     * @param unit unit of the timeout
     * @return true if terminal, false if the wait timed out
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * @return an immutable copy of the job's current state
     */
    public synchronized JobSnapshot snapshot() {
        List<TaskResult<?>> ordered = new ArrayList<>(settled);
        for (TaskResult<?> result : results) {
            if (result != null) {
                ordered.add(result);
            }
        }
        return new JobSnapshot(id, label, status, progress, totalTasks, ordered, error,
                createdAt, startedAt, endedAt, JobSummary.of(totalTasks, ordered));
    }

    @Override
    public synchronized String toString() {
        return "JobRecord{id='" + id + "', status=" + status + ", progress=" + progress + "}";
    }
}
