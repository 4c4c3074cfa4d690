package com.scrapequeue.engine;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import com.scrapequeue.core.CancellationSignal;

/**
 * Keeps a minimum spacing between requests to the same host, and counts
 * requests per host.
 *
 * <p>Callers reserve the next free start time for their host and sleep until
 * it. Reserving (rather than checking and sleeping) means two callers for the
 * same host never both wake up at the same moment.</p>
 *
 * <p>A host idle for longer than both the interval and {@link #IDLE_RETENTION_MS}
 * is forgotten, counts included, so a crawl across many hosts does not grow
 * the table without bound.</p>
 */
public class HostIntervalLimiter {
    private static final Logger logger = Logger.getLogger(HostIntervalLimiter.class.getName());

    static final long IDLE_RETENTION_MS = 10 * 60_000L;
    private static final long SWEEP_EVERY_MS = 30_000L;

    private final long intervalMs;
    private final long retentionMs;
    private final Clock clock;
    private final Map<String, HostStats> hosts = new HashMap<>();
    private long nextSweepAt;

    public HostIntervalLimiter(long intervalMs, Clock clock) {
        this.intervalMs = Math.max(0L, intervalMs);
        this.retentionMs = Math.max(this.intervalMs, IDLE_RETENTION_MS);
        this.clock = clock;
        this.nextSweepAt = clock.millis() + SWEEP_EVERY_MS;
    }

    /**
     * Reserve a start time for a request to {@code host}.
     *
     * @param host the host, null means no pacing
     * @return milliseconds to wait before starting; 0 to start now
     */
    public synchronized long reserve(String host) {
        if (host == null) {
            return 0L;
        }
        long now = clock.millis();
        if (now >= nextSweepAt) {
            evictIdle(now);
            nextSweepAt = now + SWEEP_EVERY_MS;
        }

        HostStats stats = hosts.get(host);
        if (stats == null) {
            stats = new HostStats();
            hosts.put(host, stats);
        }
        stats.requests++;
        long start = stats.requests == 1 ? now : Math.max(now, stats.lastStart + intervalMs);
        stats.lastStart = start;
        return start - now;
    }

    /**
     * Reserve and sleep until the reserved start time.
     *
     * @param host the host, null means no pacing
     * @param cancellation abandons the wait when cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitTurn(String host, CancellationSignal cancellation) throws InterruptedException {
        long waitMs = reserve(host);
        if (waitMs > 0) {
            logger.fine("Host interval active for " + host + ", waiting " + waitMs + "ms");
            cancellation.sleep(waitMs);
        }
    }

    /**
     * @return requests per recently active host, sorted by host
     */
    public synchronized Map<String, Long> getRequestCounts() {
        Map<String, Long> counts = new TreeMap<>();
        for (Map.Entry<String, HostStats> entry : hosts.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().requests);
        }
        return counts;
    }

    synchronized int trackedHostCount() {
        return hosts.size();
    }

    // caller holds the monitor
    private void evictIdle(long now) {
        int before = hosts.size();
        hosts.values().removeIf(stats -> stats.lastStart + retentionMs <= now);
        if (hosts.size() < before) {
            logger.fine("Forgot " + (before - hosts.size()) + " idle host(s)");
        }
    }

    private static final class HostStats {
        long lastStart;
        long requests;
    }
}
