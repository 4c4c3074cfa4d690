package com.scrapequeue.registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.scrapequeue.core.JobNotFoundException;
import com.scrapequeue.core.JobStatus;

/**
 * In-memory registry of batch and bulk jobs.
 *
 * <p>Jobs are kept in a ConcurrentHashMap keyed by id, so lookups are O(1) and
 * safe from any thread. Finished jobs stay until {@link #purgeFinished(Duration)}
 * removes them; there is no persistence, a restart forgets every job.</p>
 *
 * @see JobRecord
 */
public class JobRegistry {
    private static final Logger logger = Logger.getLogger(JobRegistry.class.getName());

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create a pending job.
     *
     * @param label free-form description shown in listings, may be null
     * @param totalTasks number of tasks the job will run
     * @return the new job
     */
    public JobRecord create(String label, int totalTasks) {
        String id = "job_" + UUID.randomUUID();
        JobRecord job = new JobRecord(id, label, totalTasks, clock);
        jobs.put(id, job);
        logger.info("Job created: " + id + (label != null ? " (" + label + ")" : "") + " with " + totalTasks + " tasks");
        return job;
    }

    /**
     * @param jobId the job id
     * @return the live job
     * @throws JobNotFoundException if the id is unknown
     */
    public JobRecord get(String jobId) {
        JobRecord job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * @param jobId the job id
     * @return a snapshot of the job
     * @throws JobNotFoundException if the id is unknown
     */
    public JobSnapshot snapshot(String jobId) {
        return get(jobId).snapshot();
    }

    /**
     * Cancel a job.
     *
     * @param jobId the job id
     * @return true if the job was cancelled by this call, false if it had already finished
     * @throws JobNotFoundException if the id is unknown
     */
    public boolean cancel(String jobId) {
        JobRecord job = get(jobId);
        boolean cancelled = job.cancel();
        if (cancelled) {
            logger.info("Job cancelled: " + jobId);
        } else {
            logger.warning("Could not cancel job " + jobId + " (already " + job.getStatus() + ")");
        }
        return cancelled;
    }

    /**
     * List jobs, oldest first.
     *
     * @param status only jobs in this status, or all jobs when null
     * @return snapshots of the matching jobs
     */
    public List<JobSnapshot> list(JobStatus status) {
        return jobs.values().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .sorted(Comparator.comparing(JobRecord::getCreatedAt))
                .map(JobRecord::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * Count jobs that are not finished yet.
     */
    public int countActive() {
        return (int) jobs.values().stream().filter(job -> !job.getStatus().isTerminal()).count();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Remove finished jobs that ended longer ago than the retention.
     *
     * @param retention how long to keep finished jobs
     * @return number of jobs removed
     */
    public int purgeFinished(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (JobRecord job : jobs.values()) {
            JobSnapshot snapshot = job.snapshot();
            if (snapshot.getStatus().isTerminal()
                    && snapshot.getEndedAt() != null
                    && snapshot.getEndedAt().isBefore(cutoff)
                    && jobs.remove(job.getId(), job)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged " + removed + " finished jobs");
        }
        return removed;
    }
}
