package com.scrapequeue.registry;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import com.scrapequeue.core.JobStatus;
import com.scrapequeue.core.TaskResult;

/**
 * Immutable view of a job handed to callers and to the status endpoint.
 * Results are in the order the tasks were submitted; tasks that have not
 * settled yet are absent.
 */
public final class JobSnapshot {
    private final String id;
    private final String label;
    private final JobStatus status;
    private final int progress;
    private final int totalTasks;
    private final List<TaskResult<?>> results;
    private final String error;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant endedAt;
    private final JobSummary summary;

    JobSnapshot(String id, String label, JobStatus status, int progress, int totalTasks,
                List<TaskResult<?>> results, String error, Instant createdAt,
                Instant startedAt, Instant endedAt, JobSummary summary) {
        this.id = id;
        this.label = label;
        this.status = status;
        this.progress = progress;
        this.totalTasks = totalTasks;
        this.results = Collections.unmodifiableList(results);
        this.error = error;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.summary = summary;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public JobStatus getStatus() {
        return status;
    }

    /** 0-100. */
    public int getProgress() {
        return progress;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public List<TaskResult<?>> getResults() {
        return results;
    }

    public String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public JobSummary getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return "JobSnapshot{id='" + id + "', status=" + status + ", progress=" + progress + "%, " + summary + "}";
    }
}
