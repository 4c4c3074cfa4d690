package com.scrapequeue.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.test.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

public class WindowedRateCounterTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    public void testRejectsAboveBurstUntilOldestExpires() {
        MutableClock clock = new MutableClock(T0);
        WindowedRateCounter counter = new WindowedRateCounter(10, 60_000, clock);

        for (int i = 0; i < 10; i++) {
            assertTrue(counter.tryAdmit().isAdmitted(), "Admission " + i + " is within the burst");
            clock.advance(100);
        }
        RateDecision rejected = counter.tryAdmit();
        assertFalse(rejected.isAdmitted());
        assertEquals(T0 + 60_000, rejected.getRetryAtMillis(), "Retry when the oldest admission leaves the window");
        assertEquals(10, counter.requestsInCurrentWindow());

        clock.set(T0 + 59_999);
        assertFalse(counter.tryAdmit().isAdmitted());
        clock.set(T0 + 60_000);
        assertTrue(counter.tryAdmit().isAdmitted());
        assertEquals(2, counter.getTotalRejected());
    }

    /**
     * Over a long random run no rolling window ever holds more than the burst limit.
     */
    @Test
    public void testNoRollingWindowExceedsBurst() {
        MutableClock clock = new MutableClock(T0);
        int burst = 5;
        long window = 10_000;
        WindowedRateCounter counter = new WindowedRateCounter(burst, window, clock);
        Random random = new Random(42);
        List<Long> admitted = new ArrayList<>();

        for (int step = 0; step < 2_000; step++) {
            if (counter.tryAdmit().isAdmitted()) {
                admitted.add(clock.millis());
            }
            clock.advance(random.nextInt(1_500));
        }

        assertTrue(admitted.size() > burst, "The run should span several windows");
        for (int i = 0; i < admitted.size(); i++) {
            long start = admitted.get(i);
            int inWindow = 0;
            for (int j = i; j < admitted.size() && admitted.get(j) < start + window; j++) {
                inWindow++;
            }
            assertTrue(inWindow <= burst, "Window starting at " + start + " holds " + inWindow);
        }
    }

    @Test
    public void testPauseUntilBlocksAdmissions() {
        MutableClock clock = new MutableClock(T0);
        WindowedRateCounter counter = new WindowedRateCounter(10, 60_000, clock);

        counter.pauseUntil(T0 + 5_000);
        assertTrue(counter.isPaused());
        RateDecision decision = counter.tryAdmit();
        assertFalse(decision.isAdmitted());
        assertEquals(T0 + 5_000, decision.getRetryAtMillis());

        counter.pauseUntil(T0 + 1_000);
        clock.advance(2_000);
        assertTrue(counter.isPaused(), "An earlier pause never shortens the current one");

        clock.advance(3_000);
        assertFalse(counter.isPaused());
        assertTrue(counter.tryAdmit().isAdmitted());
    }

    @Test
    public void testAwaitAdmissionWaitsForWindow() throws Exception {
        WindowedRateCounter counter = new WindowedRateCounter(2, 200, Clock.systemUTC());
        long start = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            counter.awaitAdmission(CancellationSignal.NONE);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(elapsedMs >= 150, "Third admission must wait for the window, took " + elapsedMs + "ms");
    }

    @Test
    public void testAwaitAdmissionHonorsCancellation() {
        WindowedRateCounter counter = new WindowedRateCounter(1, 60_000, Clock.systemUTC());
        assertTrue(counter.tryAdmit().isAdmitted());

        CancellationSignal signal = new CancellationSignal("job-x");
        new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        }).start();

        long start = System.nanoTime();
        assertThrows(TaskCancelledException.class, () -> counter.awaitAdmission(signal));
        assertTrue((System.nanoTime() - start) / 1_000_000 < 5_000, "Cancellation must cut the wait short");
    }
}
