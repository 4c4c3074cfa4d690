package com.scrapequeue.engine;

/**
 * The shared pieces every {@link Worker} passes a task through, in order:
 * concurrency gate, per-task delay, rate counter and host pacing, retries.
 * One instance per scheduler.
 */
final class ExecutionPipeline {
    final ConcurrencyGate gate;
    final WindowedRateCounter rateCounter;
    final HostIntervalLimiter hostLimiter;
    final AdaptiveThrottle throttle;
    final RetryCoordinator retryCoordinator;
    final ExecutionStats stats;
    final long slotWaitTimeoutMs;

    ExecutionPipeline(ConcurrencyGate gate, WindowedRateCounter rateCounter, HostIntervalLimiter hostLimiter,
                      AdaptiveThrottle throttle, RetryCoordinator retryCoordinator, ExecutionStats stats,
                      long slotWaitTimeoutMs) {
        this.gate = gate;
        this.rateCounter = rateCounter;
        this.hostLimiter = hostLimiter;
        this.throttle = throttle;
        this.retryCoordinator = retryCoordinator;
        this.stats = stats;
        this.slotWaitTimeoutMs = slotWaitTimeoutMs;
    }
}
