package com.scrapequeue.core;

/**
 * Thrown when work is offered to a scheduler that has been shut down.
 * Callers waiting for a slot at shutdown time get this too instead of
 * waiting forever.
 */
public class SchedulerClosedException extends IllegalStateException {

    public SchedulerClosedException(String message) {
        super(message);
    }
}
