package com.scrapequeue.engine;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.QueueOverloadException;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.TaskCancelledException;

/**
 * Caps how many units of work are in flight at the same time.
 *
 * <p>Callers block in {@link #acquire(CancellationSignal, long)} until one of
 * {@code capacity} permits is free and get a {@link ConcurrencySlot} back, which
 * they hand back with {@link ConcurrencySlot#release()} when the work settles.</p>
 *
 * <p><b>Key Invariants:</b></p>
 * <ul>
 *   <li>Admission is FIFO: a waiter is admitted only when it is at the head of the queue</li>
 *   <li>The active count is changed in exactly two places (admit and release) and never goes negative</li>
 *   <li>Lowering the capacity never revokes held slots; new admissions wait until
 *       the active count drops below the new capacity</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> all state is guarded by one fair {@link ReentrantLock};
 * every critical section is short and none of them wraps the work itself.</p>
 */
public class ConcurrencyGate {
    private static final Logger logger = Logger.getLogger(ConcurrencyGate.class.getName());

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition stateChanged = lock.newCondition();
    // FIFO tickets of callers blocked in acquire()
    private final ArrayDeque<Object> waiters = new ArrayDeque<>();
    private final AtomicLong slotSequence = new AtomicLong();

    private int capacity;
    private int active;
    private boolean closed;
    private long totalAdmitted;

    /**
     * @param capacity number of permits, at least 1
     * @throws IllegalArgumentException if capacity < 1
     */
    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Block until a permit is free and take it.
     *
     * @param cancellation the owning job's signal; cancelling it abandons the wait
     * @param timeoutMs the longest time to wait for a permit
     * @return the slot representing the permit
     * @throws SchedulerClosedException if the gate is or gets shut down
     * @throws TaskCancelledException if the owning job is cancelled while waiting
     * @throws QueueOverloadException if no permit became free within {@code timeoutMs}
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public ConcurrencySlot acquire(CancellationSignal cancellation, long timeoutMs) throws InterruptedException {
        Object ticket = new Object();
        Runnable unregister = cancellation.onCancel(this::wakeAll);
        lock.lock();
        try {
            if (closed) {
                throw new SchedulerClosedException("Concurrency gate is shut down");
            }
            waiters.addLast(ticket);
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            try {
                while (true) {
                    if (closed) {
                        throw new SchedulerClosedException("Concurrency gate shut down while waiting");
                    }
                    if (cancellation.isCancelled()) {
                        throw new TaskCancelledException(cancellation.getOwner() + " cancelled while waiting for a slot");
                    }
                    if (waiters.peekFirst() == ticket && active < capacity) {
                        waiters.pollFirst();
                        active++;
                        totalAdmitted++;
                        if (!waiters.isEmpty() && active < capacity) {
                            // the new head may be admissible too
                            stateChanged.signalAll();
                        }
                        ConcurrencySlot slot = new ConcurrencySlot(this, slotSequence.incrementAndGet());
                        logger.fine("Slot " + slot.getId() + " acquired (" + active + "/" + capacity + " active)");
                        return slot;
                    }
                    if (remainingNanos <= 0L) {
                        throw new QueueOverloadException(
                                "No concurrency slot became free within " + timeoutMs + "ms",
                                waiters.size(), capacity);
                    }
                    remainingNanos = stateChanged.awaitNanos(remainingNanos);
                }
            } catch (RuntimeException | InterruptedException e) {
                if (waiters.remove(ticket)) {
                    // our leaving may make the next waiter the head
                    stateChanged.signalAll();
                }
                throw e;
            }
        } finally {
            lock.unlock();
            unregister.run();
        }
    }

    /**
     * Return a permit. Called by {@link ConcurrencySlot#release()} only, which
     * guarantees at most one call per slot.
     */
    void release(ConcurrencySlot slot) {
        lock.lock();
        try {
            if (active <= 0) {
                // Scheduler bug: clamp and report, never propagate
                logger.severe("Release of slot " + slot.getId() + " with no active slots; count clamped at 0");
                active = 0;
            } else {
                active--;
            }
            stateChanged.signalAll();
            logger.fine("Slot " + slot.getId() + " released (" + active + "/" + capacity + " active)");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change the number of permits. Raising it admits waiters right away;
     * lowering it takes effect as held slots are released.
     *
     * @param newCapacity the new capacity, at least 1
     */
    public void setCapacity(int newCapacity) {
        if (newCapacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be >= 1, got " + newCapacity);
        }
        lock.lock();
        try {
            if (newCapacity != capacity) {
                logger.fine("Gate capacity " + capacity + " -> " + newCapacity);
                capacity = newCapacity;
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuse all further admissions and fail every current waiter with
     * {@link SchedulerClosedException}. Held slots can still be released.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                stateChanged.signalAll();
                logger.info("Concurrency gate shut down (" + active + " active, " + waiters.size() + " waiting)");
            }
        } finally {
            lock.unlock();
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public int getQueuedCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalAdmitted() {
        lock.lock();
        try {
            return totalAdmitted;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
