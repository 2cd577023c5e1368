package com.example.quorum.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a task within a run.
 */
public enum TaskStatus {

    /**
     * Waiting for one or more dependencies to succeed.
     */
    PENDING,

    /**
     * All dependencies have succeeded; eligible for dispatch.
     */
    READY,

    /**
     * Dispatched onto a worker slot; an agent attempt is in flight or a retry is pending.
     */
    RUNNING,

    /**
     * Fan-out answers are being collected and reduced by a consensus round.
     */
    AWAITING_CONSENSUS,

    /**
     * Finished with an accepted result.
     */
    SUCCEEDED,

    /**
     * Finished without a result; see the task's failure reason.
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Whether the task currently holds a worker slot.
     */
    public boolean isInFlight() {
        return this == RUNNING || this == AWAITING_CONSENSUS;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    private Set<TaskStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(READY, FAILED);
            case READY:
                return EnumSet.of(RUNNING, FAILED);
            case RUNNING:
                return EnumSet.of(AWAITING_CONSENSUS, SUCCEEDED, FAILED);
            case AWAITING_CONSENSUS:
                return EnumSet.of(RUNNING, SUCCEEDED, FAILED);
            default:
                return EnumSet.noneOf(TaskStatus.class);
        }
    }
}
