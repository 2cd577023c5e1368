package com.example.quorum.agent;

import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.TaskSpec;

/**
 * A worker able to answer a task.
 * Implementations differ only in how they build prompts; the orchestrator relies on this contract alone.
 */
public interface Agent {

    /**
     * Unique identifier of this agent within a run's agent pool.
     *
     * @return The agent ID
     */
    String getId();

    /**
     * Role this agent specializes in, used to route tasks that request a role.
     *
     * @return The role, or null for a general-purpose agent
     */
    default AgentRole getRole() {
        return null;
    }

    /**
     * Produces an answer for the given task.
     *
     * @param taskId The id of the task being answered
     * @param spec What to do, including any dependency context
     * @return The agent's answer
     * @throws AgentUnavailableException if the model or its transport failed
     * @throws AgentTimeoutException if the model did not answer in time
     */
    AgentAnswer propose(String taskId, TaskSpec spec);
}
