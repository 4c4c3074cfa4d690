package com.scrapequeue.engine;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.logging.Logger;

import com.scrapequeue.core.CancellationSignal;

/**
 * Caps admissions per rolling time window (the burst limit).
 *
 * <p>Keeps the timestamps of the admissions made in the last {@code windowMs}
 * milliseconds. An admission is granted while fewer than {@code maxPerWindow}
 * timestamps are inside the window; otherwise the caller is told when the
 * oldest one leaves it. This is a precise sliding window, so no rolling span of
 * {@code windowMs} ever sees more than {@code maxPerWindow} admissions, also
 * across what would be bucket boundaries in a fixed-window counter.</p>
 *
 * <p>A site that answers "too many requests" can additionally put the counter
 * into cool-down with {@link #pauseUntil(long)}; every admission before that
 * instant is rejected.</p>
 *
 * <p><b>Thread Safety:</b> all methods are synchronized; each critical section
 * is O(1) amortized (evictions are paid for by earlier admissions).</p>
 */
public class WindowedRateCounter {
    private static final Logger logger = Logger.getLogger(WindowedRateCounter.class.getName());

    private final int maxPerWindow;
    private final long windowMs;
    private final Clock clock;
    private final ArrayDeque<Long> admissions = new ArrayDeque<>();
    private long pausedUntil;
    private long totalAdmitted;
    private long totalRejected;

    /**
     * @param maxPerWindow the burst limit, at least 1
     * @param windowMs the window length in milliseconds, at least 1
     * @param clock time source
     */
    public WindowedRateCounter(int maxPerWindow, long windowMs, Clock clock) {
        if (maxPerWindow < 1) {
            throw new IllegalArgumentException("maxPerWindow must be >= 1");
        }
        if (windowMs < 1) {
            throw new IllegalArgumentException("windowMs must be >= 1");
        }
        this.maxPerWindow = maxPerWindow;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    /**
     * Try to take one admission now.
     *
     * @return admitted (and counted), or rejected with the earliest instant worth retrying at
     */
    public synchronized RateDecision tryAdmit() {
        long now = clock.millis();
        if (now < pausedUntil) {
            totalRejected++;
            return RateDecision.rejectedUntil(pausedUntil);
        }
        evictExpired(now);
        if (admissions.size() < maxPerWindow) {
            admissions.addLast(now);
            totalAdmitted++;
            return RateDecision.admitted();
        }
        totalRejected++;
        return RateDecision.rejectedUntil(admissions.peekFirst() + windowMs);
    }

    /**
     * Block until an admission is granted, sleeping through the rejection
     * intervals.
     *
     * @param cancellation abandons the wait when cancelled
     * @throws com.scrapequeue.core.TaskCancelledException if cancelled while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitAdmission(CancellationSignal cancellation) throws InterruptedException {
        while (true) {
            cancellation.throwIfCancelled();
            RateDecision decision = tryAdmit();
            if (decision.isAdmitted()) {
                return;
            }
            long waitMs = Math.max(1L, decision.getRetryAtMillis() - clock.millis());
            logger.fine("Burst limit reached, waiting " + waitMs + "ms for admission");
            cancellation.sleep(waitMs);
        }
    }

    /**
     * Reject every admission until the given instant. Later pauses extend an
     * earlier one, earlier pauses never shorten it.
     *
     * @param epochMillis end of the cool-down
     */
    public synchronized void pauseUntil(long epochMillis) {
        if (epochMillis > pausedUntil) {
            pausedUntil = epochMillis;
            logger.warning("Admissions paused for " + (epochMillis - clock.millis()) + "ms after a rate-limited response");
        }
    }

    /**
     * @return true while a cool-down imposed by {@link #pauseUntil(long)} is in effect
     */
    public synchronized boolean isPaused() {
        return clock.millis() < pausedUntil;
    }

    /**
     * @return admissions inside the current rolling window
     */
    public synchronized int requestsInCurrentWindow() {
        evictExpired(clock.millis());
        return admissions.size();
    }

    public synchronized long getTotalAdmitted() {
        return totalAdmitted;
    }

    public synchronized long getTotalRejected() {
        return totalRejected;
    }

    public int getMaxPerWindow() {
        return maxPerWindow;
    }

    public long getWindowMs() {
        return windowMs;
    }

    private void evictExpired(long now) {
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowMs) {
            admissions.pollFirst();
        }
    }
}
