package com.scrapequeue.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.Test;

import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.QueueOverloadException;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.TaskCancelledException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the concurrency gate: cap, FIFO admission, idempotent release,
 * cancellation, shutdown and the slot wait timeout.
 */
public class ConcurrencyGateTest {
    private static final long LONG_WAIT = 10_000L;

    /**
     * 30 workers with random hold times never have more than 3 slots at once.
     */
    @Test
    public void testCapNeverExceeded() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(3);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(10);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 30; i++) {
            final int n = i;
            futures.add(pool.submit(() -> {
                ConcurrencySlot slot = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
                try {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.sleep(5 + (n % 4) * 5);
                    inside.decrementAndGet();
                } finally {
                    slot.release();
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertTrue(maxInside.get() <= 3, "At most 3 concurrent holders, saw " + maxInside.get());
        assertEquals(0, gate.getActiveCount());
        assertEquals(30, gate.getTotalAdmitted());
    }

    /**
     * Releasing the same slot twice frees only one permit.
     */
    @Test
    public void testDoubleReleaseDoesNotRaiseCapacity() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot first = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        assertTrue(first.release());
        assertFalse(first.release(), "Second release is a no-op");
        assertEquals(0, gate.getActiveCount());

        ConcurrencySlot second = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        assertEquals(1, gate.getActiveCount());

        // with capacity 1 held, another acquire must still time out
        assertThrows(QueueOverloadException.class, () -> gate.acquire(CancellationSignal.NONE, 100));
        second.close();
        assertEquals(0, gate.getActiveCount());
    }

    @Test
    public void testFifoAdmission() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot held = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<Thread> threads = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            final int n = i;
            Thread thread = new Thread(() -> {
                try {
                    ConcurrencySlot slot = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
                    order.add(n);
                    slot.release();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads.add(thread);
            thread.start();
            // make sure thread n is queued before thread n+1
            waitUntil(() -> gate.getQueuedCount() == n + 1);
        }

        held.release();
        for (Thread thread : threads) {
            thread.join(5000);
        }
        assertEquals(List.of(0, 1, 2, 3), order);
    }

    @Test
    public void testCancellationAbandonsWait() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot held = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        CancellationSignal signal = new CancellationSignal("job-1");
        CountDownLatch failed = new CountDownLatch(1);
        AtomicInteger cancelledErrors = new AtomicInteger();

        Thread waiter = new Thread(() -> {
            try {
                gate.acquire(signal, LONG_WAIT);
            } catch (TaskCancelledException e) {
                cancelledErrors.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            failed.countDown();
        });
        waiter.start();
        waitUntil(() -> gate.getQueuedCount() == 1);

        signal.cancel();
        assertTrue(failed.await(2, TimeUnit.SECONDS), "Waiter should wake promptly on cancellation");
        assertEquals(1, cancelledErrors.get());
        assertEquals(0, gate.getQueuedCount());
        assertEquals(1, gate.getActiveCount(), "Held slot is unaffected");
        held.release();
    }

    @Test
    public void testShutdownFailsWaitersAndNewAcquires() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot held = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger closedErrors = new AtomicInteger();

        Thread waiter = new Thread(() -> {
            try {
                gate.acquire(CancellationSignal.NONE, LONG_WAIT);
            } catch (SchedulerClosedException e) {
                closedErrors.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();
        waitUntil(() -> gate.getQueuedCount() == 1);

        gate.shutdown();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(1, closedErrors.get());
        assertThrows(SchedulerClosedException.class, () -> gate.acquire(CancellationSignal.NONE, LONG_WAIT));

        assertTrue(held.release(), "Held slots can still be released after shutdown");
        assertEquals(0, gate.getActiveCount());
    }

    @Test
    public void testSlotWaitTimeout() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot held = gate.acquire(CancellationSignal.NONE, LONG_WAIT);

        QueueOverloadException e = assertThrows(QueueOverloadException.class,
                () -> gate.acquire(CancellationSignal.NONE, 50));
        assertEquals(1, e.getCapacity());
        assertEquals(0, gate.getQueuedCount(), "Timed-out waiter leaves the queue");
        held.release();
    }

    @Test
    public void testRaisingCapacityAdmitsWaiters() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencySlot held = gate.acquire(CancellationSignal.NONE, LONG_WAIT);
        CountDownLatch admitted = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try {
                gate.acquire(CancellationSignal.NONE, LONG_WAIT);
                admitted.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        waitUntil(() -> gate.getQueuedCount() == 1);

        gate.setCapacity(2);
        assertTrue(admitted.await(2, TimeUnit.SECONDS), "Waiter admitted once capacity grows");
        assertEquals(2, gate.getActiveCount());

        gate.setCapacity(1);
        assertEquals(2, gate.getActiveCount(), "Shrinking never revokes held slots");
        held.release();
        assertThrows(IllegalArgumentException.class, () -> gate.setCapacity(0));
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not reached within 5 seconds");
            }
            Thread.sleep(5);
        }
    }
}
