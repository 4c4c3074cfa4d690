package com.scrapequeue.core;

/**
 * A task was abandoned because its job was cancelled while the task was
 * still waiting: for a slot, for rate admission or between retries.
 * Never retried.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
