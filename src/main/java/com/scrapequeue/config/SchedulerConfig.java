package com.scrapequeue.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Tuning knobs of the scheduler.
 *
 * <p>Plain mutable bean: build one, set what differs from the defaults and hand
 * it to {@link com.scrapequeue.engine.TaskScheduler}, which copies and validates it.
 * Later changes to the instance do not affect a running scheduler.</p>
 *
 * <p>Options can also come from a properties file or system properties using the
 * option names prefixed with {@code scheduler.}, e.g. {@code scheduler.maxConcurrent=4}.</p>
 */
public class SchedulerConfig {
    private static final Logger logger = Logger.getLogger(SchedulerConfig.class.getName());

    public static final String PROPERTY_PREFIX = "scheduler.";
    public static final String DEFAULT_RESOURCE = "scheduler.properties";

    private int maxConcurrent = 3;
    private long delayMs = 0L;
    private long maxDelayMs = 10_000L;
    private int burstLimit = 10;
    private long timeWindowMs = 60_000L;
    private int maxRetries = 3;
    private long retryBaseDelayMs = 1_000L;
    private double retryBackoffMultiplier = 2.0;
    private long retryDelayCapMs = 10_000L;
    private long retryJitterMs = 250L;
    private int batchSize = 0;                  // 0 = chunk at the concurrency ceiling
    private long delayBetweenBatchesMs = 1_000L;
    private long taskTimeoutMs = 30_000L;
    private long slotWaitTimeoutMs = 120_000L;
    private long hostIntervalMs = 0L;           // 0 = no per-host spacing
    private int throttleEvaluationWindow = 20;
    private double throttleHighWatermark = 0.30;
    private double throttleLowWatermark = 0.05;
    private int throttleRecoveryWindows = 3;
    private double throttleDelayFactor = 1.5;
    private int statusPort = 8080;

    public SchedulerConfig() {
    }

    /**
     * Copy constructor.
     *
     * @param other the configuration to copy
     */
    public SchedulerConfig(SchedulerConfig other) {
        this.maxConcurrent = other.maxConcurrent;
        this.delayMs = other.delayMs;
        this.maxDelayMs = other.maxDelayMs;
        this.burstLimit = other.burstLimit;
        this.timeWindowMs = other.timeWindowMs;
        this.maxRetries = other.maxRetries;
        this.retryBaseDelayMs = other.retryBaseDelayMs;
        this.retryBackoffMultiplier = other.retryBackoffMultiplier;
        this.retryDelayCapMs = other.retryDelayCapMs;
        this.retryJitterMs = other.retryJitterMs;
        this.batchSize = other.batchSize;
        this.delayBetweenBatchesMs = other.delayBetweenBatchesMs;
        this.taskTimeoutMs = other.taskTimeoutMs;
        this.slotWaitTimeoutMs = other.slotWaitTimeoutMs;
        this.hostIntervalMs = other.hostIntervalMs;
        this.throttleEvaluationWindow = other.throttleEvaluationWindow;
        this.throttleHighWatermark = other.throttleHighWatermark;
        this.throttleLowWatermark = other.throttleLowWatermark;
        this.throttleRecoveryWindows = other.throttleRecoveryWindows;
        this.throttleDelayFactor = other.throttleDelayFactor;
        this.statusPort = other.statusPort;
    }

    // ==================== PRESETS ====================

    /**
     * Conservative limits for shop sites, which block aggressively.
     */
    public static SchedulerConfig forEcommerce() {
        return preset(2, 2_000L, 5);
    }

    public static SchedulerConfig forNews() {
        return preset(3, 1_000L, 10);
    }

    public static SchedulerConfig forJobBoards() {
        return preset(4, 1_500L, 8);
    }

    /**
     * Directory and lead sites: one request at a time.
     */
    public static SchedulerConfig forLeads() {
        return preset(1, 3_000L, 3);
    }

    /**
     * Look up a preset by name.
     *
     * @param name one of default, ecommerce, news, jobs, leads
     * @return a fresh configuration
     * @throws IllegalArgumentException for unknown names
     */
    public static SchedulerConfig preset(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "default":
                return new SchedulerConfig();
            case "ecommerce":
                return forEcommerce();
            case "news":
                return forNews();
            case "jobs":
                return forJobBoards();
            case "leads":
                return forLeads();
            default:
                throw new IllegalArgumentException("Unknown preset: " + name);
        }
    }

    private static SchedulerConfig preset(int maxConcurrent, long delayMs, int burstLimit) {
        SchedulerConfig config = new SchedulerConfig();
        config.setMaxConcurrent(maxConcurrent);
        config.setDelayMs(delayMs);
        config.setMaxDelayMs(Math.max(config.getMaxDelayMs(), delayMs * 5));
        config.setBurstLimit(burstLimit);
        config.setTimeWindowMs(60_000L);
        config.setHostIntervalMs(delayMs * 2);
        return config;
    }

    // ==================== LOADING ====================

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath if present, then apply
     * {@code scheduler.*} system properties on top.
     *
     * @param base the configuration to start from (not modified)
     * @return the merged configuration
     */
    public static SchedulerConfig load(SchedulerConfig base) {
        Properties properties = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded " + DEFAULT_RESOURCE + " from classpath");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties, base);
    }

    /**
     * Apply {@code scheduler.*} entries of the given properties to a copy of {@code base}.
     * Unknown keys under the prefix are rejected so typos do not go unnoticed.
     *
     * @param properties the source
     * @param base the configuration to start from (not modified)
     * @return the merged configuration
     * @throws IllegalArgumentException on unknown keys or unparsable values
     */
    public static SchedulerConfig fromProperties(Properties properties, SchedulerConfig base) {
        SchedulerConfig config = new SchedulerConfig(base);
        for (String name : properties.stringPropertyNames()) {
            if (!name.startsWith(PROPERTY_PREFIX)) {
                continue;
            }
            String key = name.substring(PROPERTY_PREFIX.length());
            String value = properties.getProperty(name).trim();
            try {
                config.apply(key, value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
            }
        }
        return config;
    }

    private void apply(String key, String value) {
        switch (key) {
            case "maxConcurrent" -> maxConcurrent = Integer.parseInt(value);
            case "delayMs" -> delayMs = Long.parseLong(value);
            case "maxDelayMs" -> maxDelayMs = Long.parseLong(value);
            case "burstLimit" -> burstLimit = Integer.parseInt(value);
            case "timeWindowMs" -> timeWindowMs = Long.parseLong(value);
            case "maxRetries" -> maxRetries = Integer.parseInt(value);
            case "retryBaseDelayMs" -> retryBaseDelayMs = Long.parseLong(value);
            case "retryBackoffMultiplier" -> retryBackoffMultiplier = Double.parseDouble(value);
            case "retryDelayCapMs" -> retryDelayCapMs = Long.parseLong(value);
            case "retryJitterMs" -> retryJitterMs = Long.parseLong(value);
            case "batchSize" -> batchSize = Integer.parseInt(value);
            case "delayBetweenBatchesMs" -> delayBetweenBatchesMs = Long.parseLong(value);
            case "taskTimeoutMs" -> taskTimeoutMs = Long.parseLong(value);
            case "slotWaitTimeoutMs" -> slotWaitTimeoutMs = Long.parseLong(value);
            case "hostIntervalMs" -> hostIntervalMs = Long.parseLong(value);
            case "throttleEvaluationWindow" -> throttleEvaluationWindow = Integer.parseInt(value);
            case "throttleHighWatermark" -> throttleHighWatermark = Double.parseDouble(value);
            case "throttleLowWatermark" -> throttleLowWatermark = Double.parseDouble(value);
            case "throttleRecoveryWindows" -> throttleRecoveryWindows = Integer.parseInt(value);
            case "throttleDelayFactor" -> throttleDelayFactor = Double.parseDouble(value);
            case "statusPort" -> statusPort = Integer.parseInt(value);
            default -> throw new IllegalArgumentException("Unknown scheduler option: " + key);
        }
    }

    // ==================== VALIDATION ====================

    /**
     * Check every option for a usable value.
     *
     * @throws IllegalArgumentException naming the first offending option
     */
    public void validate() {
        require(maxConcurrent >= 1, "maxConcurrent must be >= 1");
        require(delayMs >= 0, "delayMs must be >= 0");
        require(maxDelayMs >= delayMs, "maxDelayMs must be >= delayMs");
        require(burstLimit >= 1, "burstLimit must be >= 1");
        require(timeWindowMs >= 1, "timeWindowMs must be >= 1");
        require(maxRetries >= 0, "maxRetries must be >= 0");
        require(retryBaseDelayMs >= 0, "retryBaseDelayMs must be >= 0");
        require(retryBackoffMultiplier >= 1.0, "retryBackoffMultiplier must be >= 1.0");
        require(retryDelayCapMs >= 0, "retryDelayCapMs must be >= 0");
        require(retryJitterMs >= 0, "retryJitterMs must be >= 0");
        require(batchSize >= 0, "batchSize must be >= 0");
        require(delayBetweenBatchesMs >= 0, "delayBetweenBatchesMs must be >= 0");
        require(taskTimeoutMs >= 1, "taskTimeoutMs must be >= 1");
        require(slotWaitTimeoutMs >= 1, "slotWaitTimeoutMs must be >= 1");
        require(hostIntervalMs >= 0, "hostIntervalMs must be >= 0");
        require(throttleEvaluationWindow >= 1, "throttleEvaluationWindow must be >= 1");
        require(throttleLowWatermark >= 0.0 && throttleHighWatermark <= 1.0,
                "throttle watermarks must lie in [0, 1]");
        require(throttleLowWatermark < throttleHighWatermark,
                "throttleLowWatermark must be below throttleHighWatermark");
        require(throttleRecoveryWindows >= 1, "throttleRecoveryWindows must be >= 1");
        require(throttleDelayFactor > 1.0, "throttleDelayFactor must be > 1.0");
        require(statusPort >= 0 && statusPort <= 65535, "statusPort must be a valid port");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    // ==================== ACCESSORS ====================

    public int getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

    public long getDelayMs() { return delayMs; }
    public void setDelayMs(long delayMs) { this.delayMs = delayMs; }

    public long getMaxDelayMs() { return maxDelayMs; }
    public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

    public int getBurstLimit() { return burstLimit; }
    public void setBurstLimit(int burstLimit) { this.burstLimit = burstLimit; }

    public long getTimeWindowMs() { return timeWindowMs; }
    public void setTimeWindowMs(long timeWindowMs) { this.timeWindowMs = timeWindowMs; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
    public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }

    public double getRetryBackoffMultiplier() { return retryBackoffMultiplier; }
    public void setRetryBackoffMultiplier(double retryBackoffMultiplier) { this.retryBackoffMultiplier = retryBackoffMultiplier; }

    public long getRetryDelayCapMs() { return retryDelayCapMs; }
    public void setRetryDelayCapMs(long retryDelayCapMs) { this.retryDelayCapMs = retryDelayCapMs; }

    public long getRetryJitterMs() { return retryJitterMs; }
    public void setRetryJitterMs(long retryJitterMs) { this.retryJitterMs = retryJitterMs; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public long getDelayBetweenBatchesMs() { return delayBetweenBatchesMs; }
    public void setDelayBetweenBatchesMs(long delayBetweenBatchesMs) { this.delayBetweenBatchesMs = delayBetweenBatchesMs; }

    public long getTaskTimeoutMs() { return taskTimeoutMs; }
    public void setTaskTimeoutMs(long taskTimeoutMs) { this.taskTimeoutMs = taskTimeoutMs; }

    public long getSlotWaitTimeoutMs() { return slotWaitTimeoutMs; }
    public void setSlotWaitTimeoutMs(long slotWaitTimeoutMs) { this.slotWaitTimeoutMs = slotWaitTimeoutMs; }

    public long getHostIntervalMs() { return hostIntervalMs; }
    public void setHostIntervalMs(long hostIntervalMs) { this.hostIntervalMs = hostIntervalMs; }

    public int getThrottleEvaluationWindow() { return throttleEvaluationWindow; }
    public void setThrottleEvaluationWindow(int throttleEvaluationWindow) { this.throttleEvaluationWindow = throttleEvaluationWindow; }

    public double getThrottleHighWatermark() { return throttleHighWatermark; }
    public void setThrottleHighWatermark(double throttleHighWatermark) { this.throttleHighWatermark = throttleHighWatermark; }

    public double getThrottleLowWatermark() { return throttleLowWatermark; }
    public void setThrottleLowWatermark(double throttleLowWatermark) { this.throttleLowWatermark = throttleLowWatermark; }

    public int getThrottleRecoveryWindows() { return throttleRecoveryWindows; }
    public void setThrottleRecoveryWindows(int throttleRecoveryWindows) { this.throttleRecoveryWindows = throttleRecoveryWindows; }

    public double getThrottleDelayFactor() { return throttleDelayFactor; }
    public void setThrottleDelayFactor(double throttleDelayFactor) { this.throttleDelayFactor = throttleDelayFactor; }

    public int getStatusPort() { return statusPort; }
    public void setStatusPort(int statusPort) { this.statusPort = statusPort; }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "maxConcurrent=" + maxConcurrent +
                ", delayMs=" + delayMs +
                ", burstLimit=" + burstLimit +
                ", timeWindowMs=" + timeWindowMs +
                ", maxRetries=" + maxRetries +
                ", retryBaseDelayMs=" + retryBaseDelayMs +
                ", retryBackoffMultiplier=" + retryBackoffMultiplier +
                ", retryDelayCapMs=" + retryDelayCapMs +
                ", batchSize=" + batchSize +
                ", delayBetweenBatchesMs=" + delayBetweenBatchesMs +
                '}';
    }
}
