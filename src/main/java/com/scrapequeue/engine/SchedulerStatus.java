package com.scrapequeue.engine;

import java.util.Map;

/**
 * Point-in-time view of the scheduler, as returned by {@link TaskScheduler#getStatus()}.
 */
public final class SchedulerStatus {
    private final boolean running;
    private final int activeCount;
    private final int queuedCount;
    private final int currentConcurrencyLimit;
    private final long currentDelayMs;
    private final int requestsInCurrentWindow;
    private final long completedCount;
    private final long failedCount;
    private final long cancelledCount;
    private final boolean rateLimited;
    private final long averageTaskDurationMs;
    private final long estimatedTimeToCompleteMs;
    private final int activeJobs;
    private final long averageWaitTimeMs;
    private final Map<String, Long> hostRequestCounts;

    SchedulerStatus(boolean running, int activeCount, int queuedCount, int currentConcurrencyLimit,
                    long currentDelayMs, int requestsInCurrentWindow, long completedCount, long failedCount,
                    long cancelledCount, boolean rateLimited, long averageTaskDurationMs,
                    long estimatedTimeToCompleteMs, int activeJobs, long averageWaitTimeMs,
                    Map<String, Long> hostRequestCounts) {
        this.running = running;
        this.activeCount = activeCount;
        this.queuedCount = queuedCount;
        this.currentConcurrencyLimit = currentConcurrencyLimit;
        this.currentDelayMs = currentDelayMs;
        this.requestsInCurrentWindow = requestsInCurrentWindow;
        this.completedCount = completedCount;
        this.failedCount = failedCount;
        this.cancelledCount = cancelledCount;
        this.rateLimited = rateLimited;
        this.averageTaskDurationMs = averageTaskDurationMs;
        this.estimatedTimeToCompleteMs = estimatedTimeToCompleteMs;
        this.activeJobs = activeJobs;
        this.averageWaitTimeMs = averageWaitTimeMs;
        this.hostRequestCounts = hostRequestCounts;
    }

    public boolean isRunning() {
        return running;
    }

    /** Tasks holding a concurrency slot right now. */
    public int getActiveCount() {
        return activeCount;
    }

    /** Tasks waiting for a concurrency slot. */
    public int getQueuedCount() {
        return queuedCount;
    }

    public int getCurrentConcurrencyLimit() {
        return currentConcurrencyLimit;
    }

    public long getCurrentDelayMs() {
        return currentDelayMs;
    }

    public int getRequestsInCurrentWindow() {
        return requestsInCurrentWindow;
    }

    /** Tasks that settled successfully since start. */
    public long getCompletedCount() {
        return completedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    public long getCancelledCount() {
        return cancelledCount;
    }

    /**
     * @return true while the rate window is full or a rate-limit cool-down is in force
     */
    public boolean isRateLimited() {
        return rateLimited;
    }

    public long getAverageTaskDurationMs() {
        return averageTaskDurationMs;
    }

    /**
     * Rough time to drain the tasks currently waiting for a slot:
     * {@code queued * (averageDuration + delay) / ceiling}.
     */
    public long getEstimatedTimeToCompleteMs() {
        return estimatedTimeToCompleteMs;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    /** Mean time recent tasks queued for a concurrency slot. */
    public long getAverageWaitTimeMs() {
        return averageWaitTimeMs;
    }

    /**
     * @return requests per recently active host, sorted by host; unmodifiable
     */
    public Map<String, Long> getHostRequestCounts() {
        return hostRequestCounts;
    }

    @Override
    public String toString() {
        return "SchedulerStatus{running=" + running + ", active=" + activeCount + ", queued=" + queuedCount
                + ", limit=" + currentConcurrencyLimit + ", delayMs=" + currentDelayMs
                + ", inWindow=" + requestsInCurrentWindow + ", completed=" + completedCount
                + ", failed=" + failedCount + ", cancelled=" + cancelledCount
                + ", rateLimited=" + rateLimited + ", activeJobs=" + activeJobs
                + ", avgWaitMs=" + averageWaitTimeMs + ", hosts=" + hostRequestCounts.size() + "}";
    }
}
