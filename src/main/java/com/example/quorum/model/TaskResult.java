package com.example.quorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Finalized result of a succeeded task, handed to the result sink.
 */
public class TaskResult {

    private final String taskId;
    private final String content;
    private final JsonNode structuredContent;
    private final String agentId;
    private final List<String> supportingAgents;
    private final String signature;
    private final int attempt;
    private final Instant completedAt;

    @JsonCreator
    public TaskResult(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("content") String content,
            @JsonProperty("structuredContent") JsonNode structuredContent,
            @JsonProperty("agentId") String agentId,
            @JsonProperty("supportingAgents") List<String> supportingAgents,
            @JsonProperty("signature") String signature,
            @JsonProperty("attempt") int attempt,
            @JsonProperty("completedAt") Instant completedAt) {
        this.taskId = taskId;
        this.content = content;
        this.structuredContent = structuredContent;
        this.agentId = agentId;
        this.supportingAgents = supportingAgents != null ? List.copyOf(supportingAgents) : List.of();
        this.signature = signature;
        this.attempt = attempt;
        this.completedAt = completedAt;
    }

    /**
     * Result produced by a single agent without a vote.
     */
    public static TaskResult fromAnswer(AgentAnswer answer, int attempt) {
        return new TaskResult(
            answer.getTaskId(),
            answer.getContent(),
            answer.getStructuredContent(),
            answer.getAgentId(),
            List.of(answer.getAgentId()),
            null,
            attempt,
            Instant.now()
        );
    }

    public String getTaskId() {
        return taskId;
    }

    public String getContent() {
        return content;
    }

    public JsonNode getStructuredContent() {
        return structuredContent;
    }

    public String getAgentId() {
        return agentId;
    }

    public List<String> getSupportingAgents() {
        return supportingAgents;
    }

    /**
     * Consensus bucket signature, or null for single-agent results.
     */
    public String getSignature() {
        return signature;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @JsonIgnore
    public String asText() {
        if (structuredContent != null && !structuredContent.isNull()) {
            return structuredContent.toString();
        }
        return content != null ? content : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskResult that = (TaskResult) o;
        return attempt == that.attempt &&
               Objects.equals(taskId, that.taskId) &&
               Objects.equals(content, that.content) &&
               Objects.equals(structuredContent, that.structuredContent) &&
               Objects.equals(agentId, that.agentId) &&
               Objects.equals(supportingAgents, that.supportingAgents) &&
               Objects.equals(signature, that.signature) &&
               Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, content, structuredContent, agentId, supportingAgents,
                          signature, attempt, completedAt);
    }

    @Override
    public String toString() {
        return "TaskResult{" +
               "taskId='" + taskId + '\'' +
               ", agentId='" + agentId + '\'' +
               ", supportingAgents=" + supportingAgents +
               ", signature='" + signature + '\'' +
               ", attempt=" + attempt +
               '}';
    }
}
