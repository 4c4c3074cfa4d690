package com.scrapequeue.registry;

import java.util.List;

import com.scrapequeue.core.TaskResult;

/**
 * Aggregate figures over a job's settled task results.
 */
public final class JobSummary {
    private final int total;
    private final int settled;
    private final int succeeded;
    private final int failed;
    private final int cancelled;
    private final double successRate;
    private final double averageAttempts;
    private final double averageDurationMs;

    private JobSummary(int total, int settled, int succeeded, int failed, int cancelled,
                       double successRate, double averageAttempts, double averageDurationMs) {
        this.total = total;
        this.settled = settled;
        this.succeeded = succeeded;
        this.failed = failed;
        this.cancelled = cancelled;
        this.successRate = successRate;
        this.averageAttempts = averageAttempts;
        this.averageDurationMs = averageDurationMs;
    }

    static JobSummary of(int total, List<TaskResult<?>> results) {
        int succeeded = 0;
        int failed = 0;
        int cancelled = 0;
        long attempts = 0;
        long duration = 0;
        for (TaskResult<?> result : results) {
            if (result.isSuccess()) {
                succeeded++;
            } else {
                failed++;
                if (result.isCancelled()) {
                    cancelled++;
                }
            }
            attempts += result.getAttemptCount();
            duration += result.getDurationMs();
        }
        int settled = results.size();
        double successRate = settled == 0 ? 0.0 : succeeded * 100.0 / settled;
        double averageAttempts = settled == 0 ? 0.0 : (double) attempts / settled;
        double averageDuration = settled == 0 ? 0.0 : (double) duration / settled;
        return new JobSummary(total, settled, succeeded, failed, cancelled,
                successRate, averageAttempts, averageDuration);
    }

    public int getTotal() {
        return total;
    }

    public int getSettled() {
        return settled;
    }

    public int getSucceeded() {
        return succeeded;
    }

    /** Failed results, cancelled ones included. */
    public int getFailed() {
        return failed;
    }

    public int getCancelled() {
        return cancelled;
    }

    /** Percentage of settled tasks that succeeded. */
    public double getSuccessRate() {
        return successRate;
    }

    public double getAverageAttempts() {
        return averageAttempts;
    }

    public double getAverageDurationMs() {
        return averageDurationMs;
    }

    @Override
    public String toString() {
        return String.format("%d/%d settled, %d succeeded, %d failed (%.1f%% success, %.1f attempts avg, %.0fms avg)",
                settled, total, succeeded, failed, successRate, averageAttempts, averageDurationMs);
    }
}
