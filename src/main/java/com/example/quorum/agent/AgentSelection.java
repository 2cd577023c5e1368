package com.example.quorum.agent;

/**
 * How agents are drawn from the pool when a task is retried.
 */
public enum AgentSelection {

    /**
     * Every attempt uses the same agents.
     */
    REUSE,

    /**
     * Each attempt moves on to the next agents in the pool, so a retry hears from fresh voters
     * whenever the pool is larger than the fan-out.
     */
    ROTATE
}
