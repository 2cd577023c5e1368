package com.example.quorum.agent;

/**
 * The agent's model or transport returned an error.
 */
public class AgentUnavailableException extends AgentException {

    public AgentUnavailableException(String agentId, String message) {
        super(agentId, message);
    }

    public AgentUnavailableException(String agentId, String message, Throwable cause) {
        super(agentId, message, cause);
    }
}
