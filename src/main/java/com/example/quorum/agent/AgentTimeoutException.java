package com.example.quorum.agent;

import java.time.Duration;

/**
 * The agent did not produce an answer within its time limit.
 */
public class AgentTimeoutException extends AgentException {

    private final Duration timeout;

    public AgentTimeoutException(String agentId, Duration timeout) {
        super(agentId, "Agent " + agentId + " did not answer within " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public AgentTimeoutException(String agentId, Duration timeout, Throwable cause) {
        super(agentId, "Agent " + agentId + " did not answer within " + timeout.toMillis() + " ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
