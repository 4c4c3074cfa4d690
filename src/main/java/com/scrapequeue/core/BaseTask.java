package com.scrapequeue.core;

import com.google.gson.Gson;
import java.time.Instant;
import java.util.UUID;

/**
 * Abstract base class for task implementations providing common functionality.
 *
 * <p>This class handles:</p>
 * <ul>
 *   <li>UUID generation for task IDs</li>
 *   <li>Retry and timeout configuration</li>
 *   <li>JSON serialization/deserialization of payloads</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> a task instance may be executed again for a retry,
 * but never by two attempts at the same time. Setters are meant to be called
 * before the task is handed to the scheduler.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * public class MyTask extends BaseTask<String> {
 *     public CompletableFuture<String> execute(TaskContext context) {
 *         MyData data = fromPayload(getPayload(), MyData.class);
 *         return CompletableFuture.supplyAsync(() -> fetch(data.url));
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of value produced by the task
 * @see Task
 */
public abstract class BaseTask<T> implements Task<T> {
    // Shared Gson instance for JSON serialization - thread-safe
    private static final Gson gson = new Gson();

    private final String id;
    private final Instant submittedAt;
    private String payload;
    private int maxRetries = -1;      // -1 = scheduler default
    private long timeoutMillis = 0L;  // 0 = scheduler default

    /**
     * Default constructor - generates a new UUID for the task ID.
     */
    protected BaseTask() {
        this(UUID.randomUUID().toString());
    }

    /**
     * Constructor for a task with a caller-supplied opaque id.
     *
     * @param id the task id
     */
    protected BaseTask(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Task id must not be empty");
        }
        this.id = id;
        this.submittedAt = Instant.now();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getType() {
        return this.getClass().getSimpleName();
    }

    @Override
    public Instant getSubmittedAt() {
        return submittedAt;
    }

    /**
     * Get the task's serialized input.
     *
     * @return JSON payload, or null if none was set
     */
    public String getPayload() {
        return payload;
    }

    protected void setPayload(String payload) {
        this.payload = payload;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Set the maximum number of retry attempts after the first one.
     *
     * @param maxRetries the maximum retry count (0 = no retries)
     */
    public void setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
    }

    @Override
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Convert a domain object to a JSON payload string.
     *
     * @param data the object to serialize
     * @param <D> the type of the object
     * @return JSON string representation
     */
    protected <D> String toPayload(D data) {
        return gson.toJson(data);
    }

    /**
     * Deserialize a JSON payload to a domain object.
     *
     * @param payload the JSON string to deserialize
     * @param clazz the class of the target object
     * @param <D> the type of the object
     * @return the deserialized object, or null if payload is null/empty
     */
    protected <D> D fromPayload(String payload, Class<D> clazz) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        return gson.fromJson(payload, clazz);
    }

    @Override
    public String toString() {
        return getType() + "{id='" + id + "', maxRetries=" + maxRetries + "}";
    }
}
