package com.scrapequeue.engine;

import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicLong;

import com.scrapequeue.core.TaskResult;

/**
 * Running counters over every task the scheduler settled.
 */
public class ExecutionStats {
    // durations kept for the moving average
    private static final int DURATION_SAMPLES = 100;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final ArrayDeque<Long> recentDurations = new ArrayDeque<>();
    private long recentDurationSum;
    private final ArrayDeque<Long> recentWaits = new ArrayDeque<>();
    private long recentWaitSum;

    public void record(TaskResult<?> result) {
        if (result.isSuccess()) {
            succeeded.incrementAndGet();
        } else if (result.isCancelled()) {
            cancelled.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
        if (result.getAttemptCount() > 0) {
            synchronized (recentDurations) {
                recentDurations.addLast(result.getDurationMs());
                recentDurationSum += result.getDurationMs();
                if (recentDurations.size() > DURATION_SAMPLES) {
                    recentDurationSum -= recentDurations.pollFirst();
                }
            }
        }
    }

    /**
     * @param waitMs how long a task queued for its concurrency slot
     */
    public void recordWait(long waitMs) {
        synchronized (recentWaits) {
            recentWaits.addLast(waitMs);
            recentWaitSum += waitMs;
            if (recentWaits.size() > DURATION_SAMPLES) {
                recentWaitSum -= recentWaits.pollFirst();
            }
        }
    }

    public long getSucceeded() {
        return succeeded.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getCancelled() {
        return cancelled.get();
    }

    /**
     * @return mean duration of the last {@value #DURATION_SAMPLES} executed tasks, 0 if none
     */
    public long getAverageDurationMs() {
        synchronized (recentDurations) {
            return recentDurations.isEmpty() ? 0L : recentDurationSum / recentDurations.size();
        }
    }

    /**
     * @return mean slot wait of the last {@value #DURATION_SAMPLES} admitted tasks, 0 if none
     */
    public long getAverageWaitMs() {
        synchronized (recentWaits) {
            return recentWaits.isEmpty() ? 0L : recentWaitSum / recentWaits.size();
        }
    }
}
