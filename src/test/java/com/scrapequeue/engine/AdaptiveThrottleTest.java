package com.scrapequeue.engine;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.scrapequeue.config.SchedulerConfig;
import com.scrapequeue.test.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the adaptive throttle's window evaluation and hysteresis.
 */
public class AdaptiveThrottleTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);

    private static void recordWindow(AdaptiveThrottle throttle, int failures, int total) {
        for (int i = 0; i < total; i++) {
            throttle.recordOutcome(i >= failures);
        }
    }

    /**
     * 8 failures in a window of 20 (40% > 30%) lowers the ceiling by exactly one.
     */
    @Test
    public void testHighFailureRatioLowersCeiling() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(new SchedulerConfig(), clock);
        List<Integer> pushed = new ArrayList<>();
        throttle.setCeilingListener(pushed::add);

        recordWindow(throttle, 8, 20);

        assertEquals(2, throttle.getCurrentConcurrencyLimit());
        assertEquals(AdaptiveThrottle.DELAY_STEP_MS, throttle.getCurrentDelayMs(), "A zero delay steps up to the base step");
        assertEquals(List.of(2), pushed, "The gate is told about the new ceiling");
        assertEquals(1, throttle.getDecreaseCount());
        assertEquals(clock.instant(), throttle.snapshot().getLastAdjustmentAt());
    }

    @Test
    public void testModerateFailureRatioChangesNothing() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(new SchedulerConfig(), clock);
        // 2/20 = 10%, between the watermarks
        for (int window = 0; window < 5; window++) {
            recordWindow(throttle, 2, 20);
        }
        assertEquals(3, throttle.getCurrentConcurrencyLimit());
        assertEquals(0L, throttle.getCurrentDelayMs());
        assertEquals(0, throttle.getDecreaseCount() + throttle.getIncreaseCount());
        assertNull(throttle.snapshot().getLastAdjustmentAt());
    }

    @Test
    public void testRecoveryNeedsConsecutiveLowWindows() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(new SchedulerConfig(), clock);
        recordWindow(throttle, 8, 20);
        assertEquals(2, throttle.getCurrentConcurrencyLimit());

        recordWindow(throttle, 0, 20);
        recordWindow(throttle, 0, 20);
        // a moderate window resets the streak
        recordWindow(throttle, 2, 20);
        recordWindow(throttle, 0, 20);
        recordWindow(throttle, 0, 20);
        assertEquals(2, throttle.getCurrentConcurrencyLimit(), "Streak was broken, no increase yet");
        assertEquals(2, throttle.snapshot().getConsecutiveLowWindows());

        recordWindow(throttle, 0, 20);
        assertEquals(3, throttle.getCurrentConcurrencyLimit());
        assertEquals(0L, throttle.getCurrentDelayMs(), "Delay falls back to the configured floor");
        assertEquals(1, throttle.getIncreaseCount());

        for (int window = 0; window < 6; window++) {
            recordWindow(throttle, 0, 20);
        }
        assertEquals(3, throttle.getCurrentConcurrencyLimit(), "Never above maxConcurrent");
    }

    @Test
    public void testCeilingFloorAndDelayClamp() {
        SchedulerConfig config = new SchedulerConfig();
        config.setMaxDelayMs(500);
        AdaptiveThrottle throttle = new AdaptiveThrottle(config, clock);

        for (int window = 0; window < 10; window++) {
            recordWindow(throttle, 20, 20);
            ThrottleState state = throttle.snapshot();
            assertTrue(state.getCurrentConcurrencyLimit() >= 1);
            assertTrue(state.getCurrentDelayMs() <= 500);
        }
        assertEquals(1, throttle.getCurrentConcurrencyLimit());
        assertEquals(500L, throttle.getCurrentDelayMs());
    }

    @Test
    public void testDelayGrowsByFactorFromConfiguredFloor() {
        SchedulerConfig config = SchedulerConfig.forNews();
        AdaptiveThrottle throttle = new AdaptiveThrottle(config, clock);
        assertEquals(1000L, throttle.getCurrentDelayMs());

        recordWindow(throttle, 10, 20);
        assertEquals(1500L, throttle.getCurrentDelayMs());
        recordWindow(throttle, 10, 20);
        assertEquals(2250L, throttle.getCurrentDelayMs());
    }
}
