package com.scrapequeue.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.scrapequeue.config.SchedulerConfig;
import com.scrapequeue.core.BaseTask;
import com.scrapequeue.core.JobNotFoundException;
import com.scrapequeue.core.JobStatus;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TaskResult;
import com.scrapequeue.core.TerminalValidationException;
import com.scrapequeue.registry.JobSnapshot;
import com.scrapequeue.test.ScriptedTask;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the scheduler facade: caps and timing end to end, job tracking,
 * status and shutdown.
 */
public class TaskSchedulerTest {

    private TaskScheduler scheduler;
    private ExecutorService taskThreads;

    @BeforeEach
    public void setUp() {
        taskThreads = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        taskThreads.shutdownNow();
    }

    private static SchedulerConfig config(int maxConcurrent) {
        SchedulerConfig config = new SchedulerConfig();
        config.setMaxConcurrent(maxConcurrent);
        config.setBurstLimit(100);
        config.setDelayBetweenBatchesMs(0);
        config.setRetryBaseDelayMs(5);
        config.setRetryJitterMs(0);
        return config;
    }

    /** Task that tracks how many of its kind run at the same time. */
    private class TrackedTask extends BaseTask<String> {
        private final AtomicInteger inFlight;
        private final AtomicInteger maxInFlight;
        private final long holdMs;

        TrackedTask(AtomicInteger inFlight, AtomicInteger maxInFlight, long holdMs) {
            this.inFlight = inFlight;
            this.maxInFlight = maxInFlight;
            this.holdMs = holdMs;
        }

        @Override
        public CompletableFuture<String> execute(TaskContext context) {
            return CompletableFuture.supplyAsync(() -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(holdMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
                return getId();
            }, taskThreads);
        }
    }

    /**
     * 15 tasks submitted at once never run more than 3 at a time.
     */
    @Test
    public void testConcurrencyCapAcrossSubmittedTasks() throws Exception {
        scheduler = new TaskScheduler(config(3));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<CompletableFuture<TaskResult<String>>> futures = new ArrayList<>();

        for (int i = 0; i < 15; i++) {
            futures.add(scheduler.submitTask(new TrackedTask(inFlight, maxInFlight, 20)));
        }
        for (CompletableFuture<TaskResult<String>> future : futures) {
            assertTrue(future.get(10, TimeUnit.SECONDS).isSuccess());
        }

        assertTrue(maxInFlight.get() <= 3, "Cap exceeded: " + maxInFlight.get());
        assertTrue(maxInFlight.get() >= 2, "Tasks should overlap");
        assertEquals(15, scheduler.getStatus().getCompletedCount());
        assertEquals(0, scheduler.getStatus().getActiveCount());
    }

    /**
     * maxConcurrent=2 and five ~100ms tasks take about three rounds: ~300ms,
     * neither ~500ms (serial) nor ~100ms (unbounded).
     */
    @Test
    public void testTwoWideBatchOfFiveTakesThreeRounds() {
        scheduler = new TaskScheduler(config(2));
        // warm up thread pools and class loading outside the measurement
        scheduler.runTask(ScriptedTask.succeeding("warmup", 1));

        List<ScriptedTask> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tasks.add(ScriptedTask.succeeding("r-" + i, 100));
        }

        long start = System.nanoTime();
        JobSnapshot job = scheduler.runBatch("rounds", tasks);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(5, job.getSummary().getSucceeded());
        assertTrue(elapsedMs >= 250, "Too fast for a cap of 2: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 475, "Too slow, looks serial: " + elapsedMs + "ms");
    }

    @Test
    public void testTwoWideSubmittedTasksTakeThreeRounds() throws Exception {
        scheduler = new TaskScheduler(config(2));
        scheduler.runTask(ScriptedTask.succeeding("warmup", 1));

        long start = System.nanoTime();
        List<CompletableFuture<TaskResult<String>>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(scheduler.submitTask(ScriptedTask.succeeding("s-" + i, 100)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 250 && elapsedMs < 475, "Expected ~300ms, took " + elapsedMs + "ms");
    }

    @Test
    public void testBurstLimitSpreadsAdmissions() {
        SchedulerConfig config = config(5);
        config.setBurstLimit(3);
        config.setTimeWindowMs(300);
        scheduler = new TaskScheduler(config);
        List<ScriptedTask> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tasks.add(ScriptedTask.succeeding("b-" + i, 1));
        }

        long start = System.nanoTime();
        JobSnapshot job = scheduler.runBatch("burst", tasks);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(5, job.getSummary().getSucceeded());
        assertTrue(elapsedMs >= 250, "Admissions 4 and 5 wait for the window, took " + elapsedMs + "ms");
    }

    @Test
    public void testHostIntervalSpacesSameHost() {
        SchedulerConfig config = config(3);
        config.setHostIntervalMs(100);
        scheduler = new TaskScheduler(config);
        List<ScriptedTask> tasks = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            final int n = i;
            tasks.add(new ScriptedTask("h-" + i, 1, "shop.example.com", attempt -> "page " + n));
        }

        long start = System.nanoTime();
        scheduler.runBatch("paced", tasks);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 190, "Three requests to one host need two intervals, took " + elapsedMs + "ms");
    }

    @Test
    public void testRunTaskReturnsResult() {
        scheduler = new TaskScheduler(config(2));

        TaskResult<String> ok = scheduler.runTask(ScriptedTask.succeeding("single", 5));
        assertTrue(ok.isSuccess());
        assertEquals("ok:single", ok.getValue());
        assertEquals(1, ok.getAttemptCount());

        TaskResult<String> bad = scheduler.runTask(new ScriptedTask("bad", 0, attempt -> {
            throw new TerminalValidationException("404");
        }));
        assertFalse(bad.isSuccess());
        assertEquals("TerminalValidationException", bad.getErrorType());
        assertEquals(1, scheduler.getStatus().getFailedCount());
    }

    @Test
    public void testBackgroundJobLifecycle() throws Exception {
        scheduler = new TaskScheduler(config(3));
        List<ScriptedTask> tasks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            tasks.add(ScriptedTask.succeeding("bg-" + i, 20));
        }

        String jobId = scheduler.startJob("background", tasks);
        assertTrue(jobId.startsWith("job_"));

        JobSnapshot done = scheduler.awaitJob(jobId, Duration.ofSeconds(10));
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals("background", done.getLabel());
        assertEquals(100, done.getProgress());
        assertNotNull(done.getStartedAt());
        assertNotNull(done.getEndedAt());

        assertFalse(scheduler.cancelJob(jobId), "A finished job cannot be cancelled");
        assertEquals(1, scheduler.listJobs(JobStatus.COMPLETED).size());
        assertTrue(scheduler.listJobs(JobStatus.RUNNING).isEmpty());
        assertThrows(JobNotFoundException.class, () -> scheduler.getJob("job_missing"));
        assertThrows(JobNotFoundException.class, () -> scheduler.cancelJob("job_missing"));
    }

    @Test
    public void testCancelRunningBackgroundJob() throws Exception {
        SchedulerConfig config = config(1);
        config.setDelayBetweenBatchesMs(5_000);
        scheduler = new TaskScheduler(config);
        List<ScriptedTask> tasks = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            tasks.add(ScriptedTask.succeeding("long-" + i, 50));
        }

        String jobId = scheduler.startJob("slow", tasks);
        long deadline = System.currentTimeMillis() + 5_000;
        while (scheduler.getJob(jobId).getProgress() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(scheduler.cancelJob(jobId));

        JobSnapshot job = scheduler.awaitJob(jobId, Duration.ofSeconds(5));
        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertTrue(job.getResults().size() < 3);
        assertEquals(0, tasks.get(2).getAttempts());
    }

    @Test
    public void testStatusReflectsLimits() {
        SchedulerConfig config = config(4);
        config.setDelayMs(50);
        config.setMaxDelayMs(1_000);
        scheduler = new TaskScheduler(config, Clock.systemUTC());

        SchedulerStatus status = scheduler.getStatus();
        assertTrue(status.isRunning());
        assertEquals(4, status.getCurrentConcurrencyLimit());
        assertEquals(50L, status.getCurrentDelayMs());
        assertEquals(0, status.getQueuedCount());
        assertEquals(0, status.getRequestsInCurrentWindow());
        assertFalse(status.isRateLimited());

        scheduler.runTask(ScriptedTask.succeeding("counted", 1));
        assertEquals(1, scheduler.getStatus().getRequestsInCurrentWindow());
    }

    @Test
    public void testInvalidConfigRejected() {
        SchedulerConfig config = new SchedulerConfig();
        config.setMaxConcurrent(0);
        assertThrows(IllegalArgumentException.class, () -> new TaskScheduler(config));
    }

    @Test
    public void testShutdownRefusesNewWork() {
        scheduler = new TaskScheduler(config(2));
        scheduler.shutdown();
        scheduler.shutdown();

        assertFalse(scheduler.isRunning());
        assertFalse(scheduler.getStatus().isRunning());
        assertThrows(SchedulerClosedException.class, () -> scheduler.runTask(ScriptedTask.succeeding("late", 1)));
        assertThrows(SchedulerClosedException.class, () -> scheduler.startJob("late", new ArrayList<ScriptedTask>()));
    }

    @Test
    public void testSubmitTaskReportsErrorAsResult() throws Exception {
        scheduler = new TaskScheduler(config(2));

        CompletableFuture<TaskResult<String>> future = scheduler.submitTask(new ScriptedTask("linkage", 0, attempt -> {
            throw new NoClassDefFoundError("com/example/MissingParser");
        }));
        TaskResult<String> result = future.get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("NoClassDefFoundError", result.getErrorType());
        assertEquals(1, scheduler.getStatus().getFailedCount());
    }

    @Test
    public void testStatusReportsWaitTimeAndHostCounts() throws Exception {
        scheduler = new TaskScheduler(config(1));

        CompletableFuture<TaskResult<String>> first =
                scheduler.submitTask(new ScriptedTask("w-1", 150, "a.example.com", attempt -> "one"));
        CompletableFuture<TaskResult<String>> second =
                scheduler.submitTask(new ScriptedTask("w-2", 150, "a.example.com", attempt -> "two"));
        scheduler.runTask(new ScriptedTask("w-3", 1, "b.example.com", attempt -> "three"));
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        SchedulerStatus status = scheduler.getStatus();
        // With one slot, two of the three tasks queued behind a 150ms task
        assertTrue(status.getAverageWaitTimeMs() >= 30,
                "Average wait was " + status.getAverageWaitTimeMs() + "ms");
        assertEquals(2L, status.getHostRequestCounts().get("a.example.com"));
        assertEquals(1L, status.getHostRequestCounts().get("b.example.com"));
    }
}
