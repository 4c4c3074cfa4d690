package com.scrapequeue.core;

/**
 * Thrown when a job id is looked up that the registry does not know,
 * either because it never existed or because it was purged.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
