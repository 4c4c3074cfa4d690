package com.scrapequeue.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.scrapequeue.config.SchedulerConfig;
import com.scrapequeue.core.CancellationSignal;
import com.scrapequeue.core.JobStatus;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskResult;
import com.scrapequeue.registry.JobRecord;
import com.scrapequeue.registry.JobRegistry;
import com.scrapequeue.registry.JobSnapshot;

/**
 * Entry point for running scrape tasks under concurrency, rate and retry limits.
 *
 * <p>The TaskScheduler wires one instance of every moving part together and hands
 * tasks to them. Every task, whether submitted alone or as part of a job, takes
 * the same path through a {@link Worker}:</p>
 * <pre>
 * ConcurrencyGate -&gt; throttle delay -&gt; [WindowedRateCounter -&gt; HostIntervalLimiter -&gt; attempt]* -&gt; feedback
 * </pre>
 *
 * <p><b>Entry points:</b></p>
 * <ul>
 *   <li>{@link #runTask(Task)} / {@link #submitTask(Task)}: a single task, sync or async</li>
 *   <li>{@link #runBatch(String, List)}: a job run on the caller's thread</li>
 *   <li>{@link #startJob(String, List)}: a job run in the background, tracked by id</li>
 * </ul>
 *
 * <p><b>Adaptive limits:</b> the {@link AdaptiveThrottle} pushes every ceiling change
 * straight into the {@link ConcurrencyGate}, and the {@link BatchOrchestrator} re-reads
 * the ceiling before each chunk.</p>
 *
 * <p><b>Shutdown:</b> {@link #shutdown()} closes the gate so no new task is admitted,
 * fails every job still running, and then waits up to 60 seconds for in-flight
 * attempts before forcing the executors down.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * TaskScheduler scheduler = new TaskScheduler(SchedulerConfig.forNews());
 * String jobId = scheduler.startJob("front pages", tasks);
 * JobSnapshot done = scheduler.awaitJob(jobId, Duration.ofMinutes(5));
 * scheduler.shutdown();
 * }</pre>
 *
 * @see BatchOrchestrator
 * @see Worker
 */
public class TaskScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TaskScheduler.class.getName());

    private static final long SHUTDOWN_GRACE_SECONDS = 60;
    private static final long FORCED_SHUTDOWN_SECONDS = 10;
    static final String SHUTDOWN_MESSAGE = "Scheduler shut down";

    private final SchedulerConfig config;
    private final ConcurrencyGate gate;
    private final WindowedRateCounter rateCounter;
    private final HostIntervalLimiter hostLimiter;
    private final AdaptiveThrottle throttle;
    private final ExecutionStats stats;
    private final ExecutionPipeline pipeline;
    private final JobRegistry registry;
    private final ExecutorService workerPool;
    private final ExecutorService jobRunner;
    private final BatchOrchestrator orchestrator;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public TaskScheduler(SchedulerConfig config) {
        this(config, Clock.systemUTC(), BatchListener.NOOP);
    }

    public TaskScheduler(SchedulerConfig config, Clock clock) {
        this(config, clock, BatchListener.NOOP);
    }

    /**
     * @param config settings; copied, later changes have no effect
     * @param clock time source for rate windows, host pacing and job timestamps
     * @param listener progress callbacks for jobs, may be null
     * @throws IllegalArgumentException if the config is invalid
     */
    public TaskScheduler(SchedulerConfig config, Clock clock, BatchListener listener) {
        this.config = new SchedulerConfig(config);
        this.config.validate();

        this.gate = new ConcurrencyGate(this.config.getMaxConcurrent());
        this.rateCounter = new WindowedRateCounter(this.config.getBurstLimit(), this.config.getTimeWindowMs(), clock);
        this.hostLimiter = new HostIntervalLimiter(this.config.getHostIntervalMs(), clock);
        this.throttle = new AdaptiveThrottle(this.config, clock);
        this.throttle.setCeilingListener(gate::setCapacity);
        this.stats = new ExecutionStats();
        RetryCoordinator retryCoordinator = new RetryCoordinator(this.config, rateCounter, clock);
        this.pipeline = new ExecutionPipeline(gate, rateCounter, hostLimiter, throttle, retryCoordinator, stats,
                this.config.getSlotWaitTimeoutMs());

        this.registry = new JobRegistry(clock);
        this.workerPool = Executors.newCachedThreadPool(namedDaemonThreads("scrape-worker"));
        this.jobRunner = Executors.newCachedThreadPool(namedDaemonThreads("scrape-job"));
        this.orchestrator = new BatchOrchestrator(workerPool, pipeline, this.config.getBatchSize(),
                this.config.getDelayBetweenBatchesMs(), listener);

        logger.info("TaskScheduler initialized: " + this.config);
    }

    /**
     * Run one task on the calling thread.
     *
     * @param task the task
     * @param <T> the value type
     * @return the outcome; failures are reported in the result, never thrown
     * @throws SchedulerClosedException if the scheduler is shut down
     */
    public <T> TaskResult<T> runTask(Task<T> task) {
        ensureRunning();
        return new Worker<>(task, null, CancellationSignal.NONE, pipeline).call();
    }

    /**
     * Run one task on the worker pool.
     *
     * @param task the task
     * @param <T> the value type
     * @return a future completed with the outcome; it never completes exceptionally
     * @throws SchedulerClosedException if the scheduler is shut down
     */
    public <T> CompletableFuture<TaskResult<T>> submitTask(Task<T> task) {
        ensureRunning();
        Worker<T> worker = new Worker<>(task, null, CancellationSignal.NONE, pipeline);
        try {
            return CompletableFuture.supplyAsync(worker::call, workerPool);
        } catch (RejectedExecutionException e) {
            throw new SchedulerClosedException("Scheduler is shutting down, task " + task.getId() + " rejected");
        }
    }

    /**
     * Run the tasks as one job on the calling thread.
     *
     * @param label description of the job, may be null
     * @param tasks the tasks, in order
     * @param <T> the value type
     * @return the finished job
     * @throws SchedulerClosedException if the scheduler is shut down
     */
    public <T> JobSnapshot runBatch(String label, List<? extends Task<T>> tasks) {
        ensureRunning();
        List<Task<T>> copy = new ArrayList<>(tasks);
        JobRecord job = registry.create(label, copy.size());
        return orchestrator.run(job, copy);
    }

    /**
     * Start the tasks as a background job.
     *
     * @param label description of the job, may be null
     * @param tasks the tasks, in order
     * @param <T> the value type
     * @return the id to follow the job with
     * @throws SchedulerClosedException if the scheduler is shut down
     */
    public <T> String startJob(String label, List<? extends Task<T>> tasks) {
        ensureRunning();
        List<Task<T>> copy = new ArrayList<>(tasks);
        JobRecord job = registry.create(label, copy.size());
        try {
            jobRunner.execute(() -> orchestrator.run(job, copy));
        } catch (RejectedExecutionException e) {
            job.fail("Scheduler is shutting down");
            throw new SchedulerClosedException("Scheduler is shutting down, job " + job.getId() + " rejected");
        }
        return job.getId();
    }

    /**
     * @throws com.scrapequeue.core.JobNotFoundException if the id is unknown
     */
    public JobSnapshot getJob(String jobId) {
        return registry.snapshot(jobId);
    }

    /**
     * Cancel a job. Tasks waiting for a slot, admission or a retry stop at once;
     * attempts already in flight run to the end and their results are dropped.
     *
     * @return true if this call cancelled the job, false if it had already finished
     * @throws com.scrapequeue.core.JobNotFoundException if the id is unknown
     */
    public boolean cancelJob(String jobId) {
        return registry.cancel(jobId);
    }

    /**
     * @param status only jobs in this status, or null for all
     * @return matching jobs, oldest first
     */
    public List<JobSnapshot> listJobs(JobStatus status) {
        return registry.list(status);
    }

    /**
     * Wait for a job to finish.
     *
     * @param jobId the job
     * @param timeout how long to wait
     * @return the job's snapshot, terminal unless the wait timed out
     * @throws InterruptedException if interrupted while waiting
     * @throws com.scrapequeue.core.JobNotFoundException if the id is unknown
     */
    public JobSnapshot awaitJob(String jobId, Duration timeout) throws InterruptedException {
        JobRecord job = registry.get(jobId);
        job.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return job.snapshot();
    }

    public SchedulerStatus getStatus() {
        int queued = gate.getQueuedCount();
        int limit = throttle.getCurrentConcurrencyLimit();
        long delay = throttle.getCurrentDelayMs();
        long average = stats.getAverageDurationMs();
        int inWindow = rateCounter.requestsInCurrentWindow();
        boolean rateLimited = rateCounter.isPaused() || inWindow >= rateCounter.getMaxPerWindow();
        long estimate = queued * (average + delay) / Math.max(1, limit);

        return new SchedulerStatus(running.get(), gate.getActiveCount(), queued, limit, delay, inWindow,
                stats.getSucceeded(), stats.getFailed(), stats.getCancelled(), rateLimited, average, estimate,
                registry.countActive(), stats.getAverageWaitMs(),
                Collections.unmodifiableMap(hostLimiter.getRequestCounts()));
    }

    public ThrottleState getThrottleState() {
        return throttle.snapshot();
    }

    public SchedulerConfig getConfig() {
        return new SchedulerConfig(config);
    }

    public boolean isRunning() {
        return running.get();
    }

    AdaptiveThrottle getThrottle() {
        return throttle;
    }

    /**
     * Shut down gracefully. Safe to call more than once.
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Initiating graceful shutdown...");

        gate.shutdown();
        for (JobSnapshot job : registry.list(null)) {
            if (!job.getStatus().isTerminal() && registry.get(job.getId()).fail(SHUTDOWN_MESSAGE)) {
                logger.info("Failed job " + job.getId() + " on shutdown");
            }
        }

        jobRunner.shutdown();
        workerPool.shutdown();
        try {
            awaitOrForce(jobRunner, "job runner");
            awaitOrForce(workerPool, "worker pool");
        } catch (InterruptedException e) {
            jobRunner.shutdownNow();
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("TaskScheduler shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void awaitOrForce(ExecutorService executor, String name) throws InterruptedException {
        if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
            logger.warning("Forcing shutdown of the " + name);
            executor.shutdownNow();
            if (!executor.awaitTermination(FORCED_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                logger.log(Level.SEVERE, "The " + name + " did not terminate after forced shutdown");
            }
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new SchedulerClosedException("Scheduler is shut down");
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
