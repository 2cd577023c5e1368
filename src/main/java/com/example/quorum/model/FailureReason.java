package com.example.quorum.model;

/**
 * Terminal failure classification recorded on a failed task.
 */
public enum FailureReason {

    /**
     * A single-agent task exhausted its retries.
     */
    AGENT_FAILURE,

    /**
     * A consensus task ended every round without quorum or timed out.
     */
    CONSENSUS_FAILURE,

    /**
     * A dependency failed; the task was never dispatched.
     */
    UPSTREAM_FAILURE,

    /**
     * The run was cancelled before the task reached a terminal state.
     */
    CANCELLED
}
