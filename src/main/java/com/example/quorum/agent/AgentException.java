package com.example.quorum.agent;

/**
 * Failure of a single agent invocation. Recovered by the orchestrator through retry.
 */
public class AgentException extends RuntimeException {

    private final String agentId;

    public AgentException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public AgentException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    /**
     * The failing agent, or null when raised below the agent layer.
     */
    public String getAgentId() {
        return agentId;
    }
}
