package com.scrapequeue.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scrapequeue.config.SchedulerConfig;

/**
 * Scales the concurrency ceiling and the per-task delay from recent outcomes.
 *
 * <p><b>Algorithm:</b> outcomes are counted in windows of K completed tasks.
 * When a window fills up its failure ratio is compared with two watermarks:</p>
 * <ul>
 *   <li>ratio &gt; high: ceiling -1 (floor 1), delay x factor (capped at maxDelayMs)</li>
 *   <li>ratio &lt; low for M windows in a row: ceiling +1 (up to maxConcurrent),
 *       delay / factor (down to delayMs)</li>
 *   <li>anything in between: no change, and the run of low windows starts over</li>
 * </ul>
 * <p>Two watermarks instead of one threshold give hysteresis: a ratio hovering
 * around a single threshold would flip the ceiling up and down every window.</p>
 *
 * <p><b>Thread Safety:</b> {@link #recordOutcome(boolean)} is called by every
 * worker; state is guarded by the instance monitor. The ceiling listener is
 * called under the monitor so that ceiling changes reach it in order; it must
 * not call back into the throttle.</p>
 */
public class AdaptiveThrottle {
    private static final Logger logger = Logger.getLogger(AdaptiveThrottle.class.getName());

    // first step up from a zero delay
    static final long DELAY_STEP_MS = 100L;

    private final int maxConcurrent;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final int evaluationWindow;
    private final double highWatermark;
    private final double lowWatermark;
    private final int recoveryWindows;
    private final double delayFactor;
    private final Clock clock;
    private volatile IntConsumer ceilingListener = limit -> { };

    private int currentLimit;
    private long currentDelayMs;
    private int windowSuccesses;
    private int windowFailures;
    private int consecutiveLowWindows;
    private Instant lastAdjustmentAt;
    private long decreases;
    private long increases;

    public AdaptiveThrottle(SchedulerConfig config, Clock clock) {
        this.maxConcurrent = config.getMaxConcurrent();
        this.minDelayMs = config.getDelayMs();
        this.maxDelayMs = config.getMaxDelayMs();
        this.evaluationWindow = config.getThrottleEvaluationWindow();
        this.highWatermark = config.getThrottleHighWatermark();
        this.lowWatermark = config.getThrottleLowWatermark();
        this.recoveryWindows = config.getThrottleRecoveryWindows();
        this.delayFactor = config.getThrottleDelayFactor();
        this.clock = clock;
        this.currentLimit = maxConcurrent;
        this.currentDelayMs = minDelayMs;
    }

    /**
     * Register the callback told about every ceiling change, typically
     * {@link ConcurrencyGate#setCapacity(int)}.
     */
    public void setCeilingListener(IntConsumer listener) {
        this.ceilingListener = listener == null ? limit -> { } : listener;
    }

    /**
     * Count one completed task and re-evaluate when the window is full.
     *
     * @param success whether the task succeeded
     */
    public synchronized void recordOutcome(boolean success) {
        int previousLimit = currentLimit;
        if (success) {
            windowSuccesses++;
        } else {
            windowFailures++;
        }
        if (windowSuccesses + windowFailures >= evaluationWindow) {
            evaluateWindow();
        }
        if (currentLimit != previousLimit) {
            try {
                ceilingListener.accept(currentLimit);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Ceiling listener failed for limit " + currentLimit, e);
            }
        }
    }

    // caller holds the monitor
    private void evaluateWindow() {
        int total = windowSuccesses + windowFailures;
        double failureRatio = (double) windowFailures / total;
        windowSuccesses = 0;
        windowFailures = 0;

        if (failureRatio > highWatermark) {
            consecutiveLowWindows = 0;
            int limit = Math.max(1, currentLimit - 1);
            long delay = increaseDelay(currentDelayMs);
            if (limit != currentLimit || delay != currentDelayMs) {
                decreases++;
                logger.info(String.format("Failure ratio %.0f%% above %.0f%%: concurrency %d -> %d, delay %dms -> %dms",
                        failureRatio * 100, highWatermark * 100, currentLimit, limit, currentDelayMs, delay));
                applyAdjustment(limit, delay);
            }
        } else if (failureRatio < lowWatermark) {
            consecutiveLowWindows++;
            if (consecutiveLowWindows >= recoveryWindows) {
                consecutiveLowWindows = 0;
                int limit = Math.min(maxConcurrent, currentLimit + 1);
                long delay = decreaseDelay(currentDelayMs);
                if (limit != currentLimit || delay != currentDelayMs) {
                    increases++;
                    logger.info(String.format("Failure ratio below %.0f%% for %d windows: concurrency %d -> %d, delay %dms -> %dms",
                            lowWatermark * 100, recoveryWindows, currentLimit, limit, currentDelayMs, delay));
                    applyAdjustment(limit, delay);
                }
            }
        } else {
            consecutiveLowWindows = 0;
        }
    }

    private void applyAdjustment(int limit, long delay) {
        currentLimit = limit;
        currentDelayMs = delay;
        lastAdjustmentAt = clock.instant();
    }

    private long increaseDelay(long delay) {
        long next = delay == 0 ? DELAY_STEP_MS : Math.round(delay * delayFactor);
        return Math.min(maxDelayMs, Math.max(minDelayMs, next));
    }

    private long decreaseDelay(long delay) {
        long next = (long) (delay / delayFactor);
        if (next < Math.max(minDelayMs, DELAY_STEP_MS)) {
            next = minDelayMs;
        }
        return Math.max(minDelayMs, next);
    }

    public synchronized int getCurrentConcurrencyLimit() {
        return currentLimit;
    }

    public synchronized long getCurrentDelayMs() {
        return currentDelayMs;
    }

    public synchronized long getDecreaseCount() {
        return decreases;
    }

    public synchronized long getIncreaseCount() {
        return increases;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public synchronized ThrottleState snapshot() {
        return new ThrottleState(currentLimit, currentDelayMs, windowSuccesses, windowFailures,
                consecutiveLowWindows, lastAdjustmentAt);
    }
}
