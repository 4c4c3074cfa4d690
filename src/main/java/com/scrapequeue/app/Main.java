package com.scrapequeue.app;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import com.scrapequeue.config.SchedulerConfig;
import com.scrapequeue.core.Task;
import com.scrapequeue.core.TaskResult;
import com.scrapequeue.engine.BatchListener;
import com.scrapequeue.engine.TaskScheduler;
import com.scrapequeue.registry.JobSnapshot;
import com.scrapequeue.tasks.PageFetchTask;
import com.scrapequeue.tasks.SimulatedScrapeTask;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar scrape-queue-scheduler.jar [--preset default|ecommerce|news|jobs|leads] [url ...]
 * </pre>
 *
 * Fetches the given URLs as one job, or runs a demo job of simulated scrapes when
 * no URL is given. The status server stays up while the job runs.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());
    private static final Duration JOB_TIMEOUT = Duration.ofMinutes(30);

    private static TaskScheduler scheduler;
    private static StatusServer statusServer;

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Scrape Queue Scheduler Starting ===");

        try {
            String presetName = "default";
            List<String> urls = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                if ("--preset".equals(args[i]) && i + 1 < args.length) {
                    presetName = args[++i];
                } else {
                    urls.add(args[i]);
                }
            }

            // 1. Configuration: preset, then scheduler.properties and -Dscheduler.* on top
            SchedulerConfig config = SchedulerConfig.load(SchedulerConfig.preset(presetName));
            logger.info("Using preset '" + presetName + "': " + config);

            // 2. Scheduler and status server
            scheduler = new TaskScheduler(config, Clock.systemUTC(), new ProgressReporter());
            statusServer = new StatusServer(scheduler, config.getStatusPort());
            statusServer.start();

            // 3. Shutdown hook for Ctrl+C
            addShutdownHook();

            // 4. Run the job
            List<Task<?>> tasks = urls.isEmpty() ? demoTasks() : fetchTasks(urls);
            String jobId = scheduler.startJob(urls.isEmpty() ? "demo" : "fetch " + urls.size() + " urls", cast(tasks));
            logger.info("Job " + jobId + " started, status at http://localhost:" + statusServer.getPort() + "/jobs/" + jobId);

            JobSnapshot result = scheduler.awaitJob(jobId, JOB_TIMEOUT);
            printSummary(result);

        } catch (IllegalArgumentException e) {
            logger.severe("Invalid configuration: " + e.getMessage());
            System.exit(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error", e);
            System.exit(1);
        } finally {
            stopAll();
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private static List<Task<?>> fetchTasks(List<String> urls) {
        List<Task<?>> tasks = new ArrayList<>();
        for (String url : urls) {
            tasks.add(new PageFetchTask(url));
        }
        return tasks;
    }

    private static List<Task<?>> demoTasks() {
        List<Task<?>> tasks = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            String url = "https://shop" + (i % 3) + ".example.com/products/" + i;
            if (i % 5 == 0) {
                tasks.add(SimulatedScrapeTask.flaky(url, 150, 1));
            } else if (i == 7) {
                tasks.add(new SimulatedScrapeTask(url, 50, SimulatedScrapeTask.Mode.TERMINAL));
            } else {
                tasks.add(SimulatedScrapeTask.succeeding(url, 100 + i * 10));
            }
        }
        return tasks;
    }

    // Jobs of mixed task types run as Task<Object>
    @SuppressWarnings("unchecked")
    private static List<Task<Object>> cast(List<Task<?>> tasks) {
        return (List<Task<Object>>) (List<?>) tasks;
    }

    private static void printSummary(JobSnapshot job) {
        System.out.println();
        System.out.println("Job " + job.getId() + " " + job.getStatus() + " (" + job.getProgress() + "%)");
        for (TaskResult<?> result : job.getResults()) {
            String outcome = result.isSuccess()
                    ? "OK   " + result.getValue()
                    : "FAIL " + result.getErrorType() + ": " + result.getErrorMessage();
            System.out.println("  " + outcome + " [" + result.getAttemptCount() + " attempt(s), "
                    + result.getDurationMs() + "ms]");
        }
        System.out.println(job.getSummary());
        System.out.println(scheduler.getStatus());
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stopAll();
        }, "Shutdown-Hook"));
    }

    private static synchronized void stopAll() {
        if (statusServer != null) {
            statusServer.stop();
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private static class ProgressReporter implements BatchListener {
        @Override
        public void onChunkDispatched(String jobId, int chunkIndex, int chunkSize) {
            logger.info("Chunk " + (chunkIndex + 1) + " dispatched (" + chunkSize + " tasks)");
        }

        @Override
        public void onTaskSettled(String jobId, int taskIndex, TaskResult<?> result) {
            logger.fine("Task #" + taskIndex + (result.isSuccess() ? " done" : " failed"));
        }
    }
}
