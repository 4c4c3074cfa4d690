package com.scrapequeue.config;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerConfigTest {

    @AfterEach
    public void clearSystemProperties() {
        System.clearProperty("scheduler.maxConcurrent");
    }

    @Test
    public void testDefaults() {
        SchedulerConfig config = new SchedulerConfig();
        assertEquals(3, config.getMaxConcurrent());
        assertEquals(0L, config.getDelayMs());
        assertEquals(10, config.getBurstLimit());
        assertEquals(60_000L, config.getTimeWindowMs());
        assertEquals(3, config.getMaxRetries());
        assertEquals(20, config.getThrottleEvaluationWindow());
        assertEquals(0.30, config.getThrottleHighWatermark(), 1e-9);
        assertEquals(0.05, config.getThrottleLowWatermark(), 1e-9);
        assertDoesNotThrow(config::validate);
    }

    @Test
    public void testPresets() {
        SchedulerConfig ecommerce = SchedulerConfig.preset("ecommerce");
        assertEquals(2, ecommerce.getMaxConcurrent());
        assertEquals(2000L, ecommerce.getDelayMs());
        assertEquals(5, ecommerce.getBurstLimit());
        assertEquals(4000L, ecommerce.getHostIntervalMs(), "Host interval is twice the delay");

        SchedulerConfig leads = SchedulerConfig.preset("LEADS");
        assertEquals(1, leads.getMaxConcurrent());
        assertEquals(3, leads.getBurstLimit());
        assertTrue(leads.getMaxDelayMs() >= leads.getDelayMs());

        assertEquals(4, SchedulerConfig.preset("jobs").getMaxConcurrent());
        assertEquals(10, SchedulerConfig.preset("news").getBurstLimit());
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.preset("crypto"));

        for (String name : new String[] {"default", "ecommerce", "news", "jobs", "leads"}) {
            assertDoesNotThrow(() -> SchedulerConfig.preset(name).validate(), name + " preset must be valid");
        }
    }

    @Test
    public void testValidationRejectsBadValues() {
        SchedulerConfig zeroConcurrency = new SchedulerConfig();
        zeroConcurrency.setMaxConcurrent(0);
        assertThrows(IllegalArgumentException.class, zeroConcurrency::validate);

        SchedulerConfig zeroBurst = new SchedulerConfig();
        zeroBurst.setBurstLimit(0);
        assertThrows(IllegalArgumentException.class, zeroBurst::validate);

        SchedulerConfig invertedWatermarks = new SchedulerConfig();
        invertedWatermarks.setThrottleLowWatermark(0.5);
        invertedWatermarks.setThrottleHighWatermark(0.2);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, invertedWatermarks::validate);
        assertTrue(e.getMessage().contains("throttleLowWatermark"));
    }

    @Test
    public void testFromPropertiesOverridesBase() {
        Properties properties = new Properties();
        properties.setProperty("scheduler.maxConcurrent", "6");
        properties.setProperty("scheduler.retryBackoffMultiplier", "3.0");
        properties.setProperty("unrelated.key", "ignored");

        SchedulerConfig base = SchedulerConfig.forNews();
        SchedulerConfig merged = SchedulerConfig.fromProperties(properties, base);

        assertEquals(6, merged.getMaxConcurrent());
        assertEquals(3.0, merged.getRetryBackoffMultiplier(), 1e-9);
        assertEquals(base.getDelayMs(), merged.getDelayMs(), "Untouched options keep the base value");
        assertEquals(3, base.getMaxConcurrent(), "Base must not be modified");
    }

    @Test
    public void testFromPropertiesRejectsUnknownAndMalformed() {
        Properties typo = new Properties();
        typo.setProperty("scheduler.maxConcurent", "6");
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromProperties(typo, new SchedulerConfig()));

        Properties malformed = new Properties();
        malformed.setProperty("scheduler.burstLimit", "ten");
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromProperties(malformed, new SchedulerConfig()));
    }

    @Test
    public void testLoadAppliesSystemProperties() {
        System.setProperty("scheduler.maxConcurrent", "7");
        SchedulerConfig loaded = SchedulerConfig.load(new SchedulerConfig());
        assertEquals(7, loaded.getMaxConcurrent());
        assertEquals(10, loaded.getBurstLimit());
    }
}
