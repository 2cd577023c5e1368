package com.example.quorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single agent's answer for a task. Created per invocation and consumed by a consensus round.
 */
public class AgentAnswer {

    private final String taskId;
    private final String agentId;
    private final String role;
    private final String content;
    private final JsonNode structuredContent;
    private final double[] embedding;
    private final double confidence;
    private final Instant timestamp;

    @JsonCreator
    public AgentAnswer(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("agentId") String agentId,
            @JsonProperty("role") String role,
            @JsonProperty("content") String content,
            @JsonProperty("structuredContent") JsonNode structuredContent,
            @JsonProperty("embedding") double[] embedding,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("timestamp") Instant timestamp) {
        this.taskId = taskId;
        this.agentId = agentId;
        this.role = role;
        this.content = content;
        this.structuredContent = structuredContent;
        this.embedding = embedding != null ? embedding.clone() : null;
        this.confidence = confidence;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static AgentAnswer text(String taskId, String agentId, String content) {
        return new AgentAnswer(taskId, agentId, null, content, null, null, 1.0, Instant.now());
    }

    public static AgentAnswer structured(String taskId, String agentId, JsonNode structuredContent) {
        return new AgentAnswer(taskId, agentId, null, null, structuredContent, null, 1.0, Instant.now());
    }

    public String getTaskId() {
        return taskId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public JsonNode getStructuredContent() {
        return structuredContent;
    }

    public double[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public boolean isStructured() {
        return structuredContent != null && !structuredContent.isNull() && !structuredContent.isMissingNode();
    }

    @JsonIgnore
    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /**
     * An answer with neither text nor structured content counts as a failed call.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return !isStructured() && (content == null || content.isBlank());
    }

    /**
     * Text form of the answer, structured content rendered as JSON.
     */
    @JsonIgnore
    public String asText() {
        if (isStructured()) {
            return structuredContent.toString();
        }
        return content != null ? content : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentAnswer that = (AgentAnswer) o;
        return Double.compare(that.confidence, confidence) == 0 &&
               Objects.equals(taskId, that.taskId) &&
               Objects.equals(agentId, that.agentId) &&
               Objects.equals(role, that.role) &&
               Objects.equals(content, that.content) &&
               Objects.equals(structuredContent, that.structuredContent) &&
               Arrays.equals(embedding, that.embedding) &&
               Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(taskId, agentId, role, content, structuredContent, confidence, timestamp);
        result = 31 * result + Arrays.hashCode(embedding);
        return result;
    }

    @Override
    public String toString() {
        return "AgentAnswer{" +
               "taskId='" + taskId + '\'' +
               ", agentId='" + agentId + '\'' +
               ", role='" + role + '\'' +
               ", content='" + abbreviate(asText()) + '\'' +
               ", confidence=" + confidence +
               ", timestamp=" + timestamp +
               '}';
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
