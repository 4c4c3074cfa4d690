package com.scrapequeue.core;

/**
 * Exception thrown when a task waited longer than the configured bound for a
 * concurrency slot.
 *
 * <p>This is the scheduler's stall detector: rather than letting a caller hang
 * behind a queue that is not moving (slots held by hung operations, a ceiling
 * throttled down to 1 under a long backlog), the wait fails loudly and the task
 * is reported as failed with this error.</p>
 *
 * <p><b>Recovery:</b> the task never started, so it is safe to resubmit once
 * the queue has drained.</p>
 *
 * @see com.scrapequeue.engine.ConcurrencyGate#acquire(CancellationSignal, long)
 */
public class QueueOverloadException extends RuntimeException {

    private final int queuedCount;
    private final int capacity;

    public QueueOverloadException(String message) {
        super(message);
        this.queuedCount = -1;
        this.capacity = -1;
    }

    /**
     * @param message the error message
     * @param queuedCount callers waiting for a slot when the wait gave up
     * @param capacity the gate capacity at that time
     */
    public QueueOverloadException(String message, int queuedCount, int capacity) {
        super(message);
        this.queuedCount = queuedCount;
        this.capacity = capacity;
    }

    /**
     * @return the number of waiting callers, or -1 if not available
     */
    public int getQueuedCount() {
        return queuedCount;
    }

    /**
     * @return the gate capacity, or -1 if not available
     */
    public int getCapacity() {
        return capacity;
    }
}
