package com.scrapequeue.registry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.scrapequeue.core.JobNotFoundException;
import com.scrapequeue.core.JobStatus;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.core.TaskResult;
import com.scrapequeue.core.TransientNetworkException;
import com.scrapequeue.test.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for job lifecycle, progress, cancellation and lookup.
 */
public class JobRegistryTest {

    private MutableClock clock;
    private JobRegistry registry;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        registry = new JobRegistry(clock);
    }

    @Test
    public void testCreateAndLookup() {
        JobRecord job = registry.create("catalog", 4);

        assertTrue(job.getId().startsWith("job_"));
        assertSame(job, registry.get(job.getId()));
        JobSnapshot snapshot = registry.snapshot(job.getId());
        assertEquals(JobStatus.PENDING, snapshot.getStatus());
        assertEquals("catalog", snapshot.getLabel());
        assertEquals(0, snapshot.getProgress());
        assertEquals(4, snapshot.getTotalTasks());
        assertNull(snapshot.getStartedAt());

        assertThrows(JobNotFoundException.class, () -> registry.get("job_unknown"));
        assertThrows(JobNotFoundException.class, () -> registry.get(null));
    }

    @Test
    public void testProgressIsMonotonicAndTerminalOnce() {
        JobRecord job = registry.create("progress", 3);
        assertTrue(job.markRunning());
        clock.advance(100);

        assertTrue(job.recordResult(2, TaskResult.success("c", "v", 1, 10)));
        assertEquals(33, job.getProgress());
        assertFalse(job.recordResult(2, TaskResult.success("c", "v", 1, 10)), "Duplicate position is discarded");
        assertEquals(33, job.getProgress());

        job.recordResult(0, TaskResult.success("a", "v", 1, 10));
        job.recordResult(1, TaskResult.failure("b", new TransientNetworkException("reset"), 3, 30));
        assertEquals(100, job.getProgress());

        assertTrue(job.complete());
        assertFalse(job.complete(), "Terminal exactly once");
        assertFalse(job.fail("late"));
        assertFalse(job.cancel());

        JobSnapshot snapshot = job.snapshot();
        assertEquals(JobStatus.COMPLETED, snapshot.getStatus());
        assertEquals(List.of("a", "b", "c"),
                List.of(snapshot.getResults().get(0).getTaskId(), snapshot.getResults().get(1).getTaskId(),
                        snapshot.getResults().get(2).getTaskId()));
        assertEquals(2, snapshot.getSummary().getSucceeded());
        assertEquals(1, snapshot.getSummary().getFailed());
        assertEquals(5.0 / 3, snapshot.getSummary().getAverageAttempts(), 1e-9);
        assertNotNull(snapshot.getEndedAt());
    }

    @Test
    public void testNoResultsAfterTerminal() {
        JobRecord job = registry.create("late results", 2);
        job.markRunning();
        assertTrue(registry.cancel(job.getId()));

        assertFalse(job.recordResult(0, TaskResult.success("a", "v", 1, 5)));
        assertTrue(job.snapshot().getResults().isEmpty());
        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertFalse(registry.cancel(job.getId()), "Second cancel reports false");
    }

    @Test
    public void testCancelSignalsWaiters() throws Exception {
        JobRecord job = registry.create("signal", 1);
        assertFalse(job.isCancelled());

        registry.cancel(job.getId());

        assertTrue(job.isCancelled());
        assertThrows(TaskCancelledException.class, () -> job.getCancellation().sleep(10_000));
        assertTrue(job.awaitTermination(1, TimeUnit.SECONDS));
    }

    @Test
    public void testFailSignalsWaiters() throws Exception {
        JobRecord job = registry.create("shut down", 2);
        job.markRunning();

        assertTrue(job.fail("Scheduler shut down"));

        assertTrue(job.isCancelled());
        assertThrows(TaskCancelledException.class, () -> job.getCancellation().sleep(10_000));
        assertTrue(job.awaitTermination(1, TimeUnit.SECONDS));
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertFalse(job.cancel(), "A failed job stays failed");
    }

    @Test
    public void testEmptyJobCompletes() {
        JobRecord job = registry.create("empty", 0);
        assertTrue(job.complete());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(100, job.getProgress());
    }

    @Test
    public void testPendingJobCannotComplete() {
        JobRecord job = registry.create("never started", 2);
        assertFalse(job.complete());
        assertTrue(job.fail("executor rejected"));
        assertEquals("executor rejected", job.snapshot().getError());
    }

    @Test
    public void testListFilterCountAndPurge() {
        JobRecord running = registry.create("a", 1);
        running.markRunning();
        JobRecord done = registry.create("b", 0);
        done.complete();
        registry.create("c", 1);

        assertEquals(3, registry.list(null).size());
        assertEquals(1, registry.list(JobStatus.RUNNING).size());
        assertEquals(done.getId(), registry.list(JobStatus.COMPLETED).get(0).getId());
        assertEquals(2, registry.countActive());

        assertEquals(0, registry.purgeFinished(Duration.ofMinutes(5)), "Too recent to purge");
        clock.advance(Duration.ofMinutes(10).toMillis());
        assertEquals(1, registry.purgeFinished(Duration.ofMinutes(5)));
        assertEquals(2, registry.size());
        assertThrows(JobNotFoundException.class, () -> registry.get(done.getId()));
    }
}
