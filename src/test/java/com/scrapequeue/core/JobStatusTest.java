package com.scrapequeue.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testTerminalStates() {
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());
    }

    @Test
    public void testAllowedTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED));

        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED), "Cannot complete without running");
        for (JobStatus terminal : new JobStatus[] {JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED}) {
            for (JobStatus target : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " must be final");
            }
        }
    }

    @Test
    public void testFromString() {
        assertEquals(JobStatus.RUNNING, JobStatus.fromString("running"));
        assertEquals(JobStatus.CANCELLED, JobStatus.fromString("CANCELLED"));
        assertEquals("completed", JobStatus.COMPLETED.toString());
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromString("paused"));
    }
}
