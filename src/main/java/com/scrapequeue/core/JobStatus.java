package com.scrapequeue.core;

/**
 * Enum representing the states a batch or bulk job goes through.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: first chunk dispatched</li>
 *   <li>PENDING → CANCELLED: cancelled before anything was dispatched</li>
 *   <li>RUNNING → COMPLETED: every chunk settled</li>
 *   <li>RUNNING → FAILED: the orchestration itself broke (not a task failure)</li>
 *   <li>RUNNING → CANCELLED: cancelled while chunks remained</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status represents a terminal state.
     * Terminal states are final - jobs cannot transition out of them.
     *
     * @return true for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: once a job reaches a terminal state it cannot transition
     * to any other state, so each job is finished exactly once.</p>
     *
     * @param newStatus the target status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == CANCELLED || newStatus == FAILED;
            case RUNNING -> newStatus == COMPLETED || newStatus == FAILED || newStatus == CANCELLED;
            default -> false;
        };
    }

    /**
     * Parse a status from its display name or constant name, ignoring case.
     *
     * @param value e.g. "running" or "RUNNING"
     * @return the status
     * @throws IllegalArgumentException if the value names no status
     */
    public static JobStatus fromString(String value) {
        for (JobStatus status : values()) {
            if (status.displayName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
