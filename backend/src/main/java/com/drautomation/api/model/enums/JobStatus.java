package com.drautomation.api.model.enums;

/**
 * Lifecycle shared by backup, replication, restore, recovery-test and recovery runs.
 * Declaration order is the only allowed direction of travel.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean canTransitionTo(JobStatus next) {
        return next != null && !isTerminal() && next.ordinal() > ordinal();
    }

    /**
     * Returns {@code next} when the move is allowed.
     *
     * @throws IllegalStateException on a backward move or a move out of a terminal status
     */
    public JobStatus transitionTo(JobStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Invalid status transition: " + this + " -> " + next);
        }
        return next;
    }
}
