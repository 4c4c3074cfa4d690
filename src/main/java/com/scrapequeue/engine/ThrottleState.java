package com.scrapequeue.engine;

import java.time.Instant;

/**
 * Point-in-time copy of the {@link AdaptiveThrottle}'s state.
 */
public final class ThrottleState {
    private final int currentConcurrencyLimit;
    private final long currentDelayMs;
    private final int recentSuccesses;
    private final int recentFailures;
    private final int consecutiveLowWindows;
    private final Instant lastAdjustmentAt;

    ThrottleState(int currentConcurrencyLimit, long currentDelayMs, int recentSuccesses,
                  int recentFailures, int consecutiveLowWindows, Instant lastAdjustmentAt) {
        this.currentConcurrencyLimit = currentConcurrencyLimit;
        this.currentDelayMs = currentDelayMs;
        this.recentSuccesses = recentSuccesses;
        this.recentFailures = recentFailures;
        this.consecutiveLowWindows = consecutiveLowWindows;
        this.lastAdjustmentAt = lastAdjustmentAt;
    }

    public int getCurrentConcurrencyLimit() {
        return currentConcurrencyLimit;
    }

    public long getCurrentDelayMs() {
        return currentDelayMs;
    }

    /** Successes counted in the evaluation window still being filled. */
    public int getRecentSuccesses() {
        return recentSuccesses;
    }

    /** Failures counted in the evaluation window still being filled. */
    public int getRecentFailures() {
        return recentFailures;
    }

    public int getConsecutiveLowWindows() {
        return consecutiveLowWindows;
    }

    /** When the ceiling or delay last changed; null if never. */
    public Instant getLastAdjustmentAt() {
        return lastAdjustmentAt;
    }

    @Override
    public String toString() {
        return "ThrottleState{limit=" + currentConcurrencyLimit +
                ", delayMs=" + currentDelayMs +
                ", window=" + recentSuccesses + "ok/" + recentFailures + "failed" +
                ", lowWindows=" + consecutiveLowWindows + "}";
    }
}
