package com.scrapequeue.tasks;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

import com.scrapequeue.core.BaseTask;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TerminalValidationException;
import com.scrapequeue.core.TransientNetworkException;

/**
 * A scrape that never touches the network: it waits {@code latencyMs} and then
 * behaves as its {@link Mode} says. Used by the demo run and by tests.
 */
public class SimulatedScrapeTask extends BaseTask<String> {

    public enum Mode {
        /** Every attempt succeeds. */
        SUCCEED,
        /** Every attempt fails with a retryable error. */
        TRANSIENT,
        /** The first attempt fails with a terminal error. */
        TERMINAL,
        /** The first {@code failuresBeforeSuccess} attempts fail with a retryable error. */
        FLAKY
    }

    public static class ScrapeSpec {
        public String url;
        public long latencyMs;
        public Mode mode;
        public int failuresBeforeSuccess;

        public ScrapeSpec() {}

        public ScrapeSpec(String url, long latencyMs, Mode mode, int failuresBeforeSuccess) {
            this.url = url;
            this.latencyMs = latencyMs;
            this.mode = mode;
            this.failuresBeforeSuccess = failuresBeforeSuccess;
        }
    }

    private final AtomicInteger executions = new AtomicInteger();

    public SimulatedScrapeTask(String url, long latencyMs, Mode mode) {
        this(url, latencyMs, mode, 0);
    }

    public SimulatedScrapeTask(String url, long latencyMs, Mode mode, int failuresBeforeSuccess) {
        super();
        setPayload(toPayload(new ScrapeSpec(url, latencyMs, mode, failuresBeforeSuccess)));
    }

    public static SimulatedScrapeTask succeeding(String url, long latencyMs) {
        return new SimulatedScrapeTask(url, latencyMs, Mode.SUCCEED);
    }

    public static SimulatedScrapeTask flaky(String url, long latencyMs, int failuresBeforeSuccess) {
        return new SimulatedScrapeTask(url, latencyMs, Mode.FLAKY, failuresBeforeSuccess);
    }

    public ScrapeSpec getSpec() {
        ScrapeSpec spec = fromPayload(getPayload(), ScrapeSpec.class);
        if (spec == null || spec.mode == null) {
            throw new TerminalValidationException("Simulated scrape " + getId() + " has no spec");
        }
        return spec;
    }

    /**
     * @return how many attempts were started on this task
     */
    public int getExecutionCount() {
        return executions.get();
    }

    @Override
    public String getHost() {
        String url = getSpec().url;
        try {
            return url == null ? null : URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public CompletableFuture<String> execute(TaskContext context) {
        ScrapeSpec spec = getSpec();
        int attempt = executions.incrementAndGet();
        context.log(Level.FINE, "Simulating " + spec.mode + " scrape of " + spec.url + " (attempt " + attempt + ")");

        return CompletableFuture.supplyAsync(() -> outcome(spec, attempt),
                CompletableFuture.delayedExecutor(Math.max(0L, spec.latencyMs), TimeUnit.MILLISECONDS));
    }

    private String outcome(ScrapeSpec spec, int attempt) {
        switch (spec.mode) {
            case TRANSIENT:
                throw new TransientNetworkException("Connection reset while scraping " + spec.url);
            case TERMINAL:
                throw new TerminalValidationException("Page not found: " + spec.url);
            case FLAKY:
                if (attempt <= spec.failuresBeforeSuccess) {
                    throw new TransientNetworkException("Timeout scraping " + spec.url + " (attempt " + attempt + ")");
                }
                return "<html>" + spec.url + "</html>";
            default:
                return "<html>" + spec.url + "</html>";
        }
    }
}
