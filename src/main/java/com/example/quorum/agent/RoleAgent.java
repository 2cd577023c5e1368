package com.example.quorum.agent;

import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.JsonCodec;
import com.example.quorum.model.TaskSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Agent that frames tasks for its {@link AgentRole} and delegates to a {@link LanguageModel}.
 *
 * <p>Tasks whose spec sets {@code responseFormat=json} get their answer parsed into structured
 * content, which consensus compares exactly. When an {@link Embedder} is present, free-text answers
 * carry an embedding for similarity voting.
 */
public class RoleAgent implements Agent {

    private static final Logger logger = LoggerFactory.getLogger(RoleAgent.class);

    public static final String RESPONSE_FORMAT_ATTRIBUTE = "responseFormat";
    public static final String JSON_FORMAT = "json";

    private final String id;
    private final AgentRole role;
    private final LanguageModel model;
    private final Embedder embedder;

    public RoleAgent(String id, AgentRole role, LanguageModel model) {
        this(id, role, model, null);
    }

    public RoleAgent(String id, AgentRole role, LanguageModel model, Embedder embedder) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
        if (role == null || model == null) {
            throw new IllegalArgumentException("Role and model are required for agent " + id);
        }
        this.id = id;
        this.role = role;
        this.model = model;
        this.embedder = embedder;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentRole getRole() {
        return role;
    }

    @Override
    public AgentAnswer propose(String taskId, TaskSpec spec) {
        String prompt = role.frame(spec.toPrompt());
        String response;
        try {
            response = model.generate(role.getSystemPrompt(), prompt);
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentUnavailableException(id, "Model call failed for agent " + id + ": " + e.getMessage(), e);
        }
        logger.debug("Agent {} ({}) answered task {} with {} chars", id, role,
                     taskId, response != null ? response.length() : 0);

        JsonNode structured = null;
        if (JSON_FORMAT.equalsIgnoreCase(spec.getAttributes().get(RESPONSE_FORMAT_ATTRIBUTE))) {
            structured = parseStructured(taskId, response);
        }
        double[] embedding = structured == null ? embed(taskId, response) : null;

        return new AgentAnswer(taskId, id, role.name(), response, structured, embedding, 1.0, Instant.now());
    }

    private JsonNode parseStructured(String taskId, String response) {
        String json = extractJson(response);
        if (json == null) {
            logger.warn("Agent {} returned no JSON for task {}; comparing as text", id, taskId);
            return null;
        }
        try {
            return JsonCodec.getObjectMapper().readTree(json);
        } catch (JsonProcessingException e) {
            logger.warn("Agent {} returned malformed JSON for task {}; comparing as text: {}",
                        id, taskId, e.getOriginalMessage());
            return null;
        }
    }

    private double[] embed(String taskId, String response) {
        if (embedder == null || response == null || response.isBlank()) {
            return null;
        }
        try {
            return embedder.embed(response);
        } catch (RuntimeException e) {
            logger.warn("Embedding failed for agent {} on task {}; falling back to text similarity",
                        id, taskId, e);
            return null;
        }
    }

    /**
     * Returns the outermost JSON object or array in the text, tolerating surrounding prose.
     */
    static String extractJson(String text) {
        if (text == null) {
            return null;
        }
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char close;
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            start = objectStart;
            close = '}';
        } else if (arrayStart >= 0) {
            start = arrayStart;
            close = ']';
        } else {
            return null;
        }
        int end = text.lastIndexOf(close);
        return end > start ? text.substring(start, end + 1) : null;
    }

    @Override
    public String toString() {
        return "RoleAgent{id='" + id + "', role=" + role + '}';
    }
}
