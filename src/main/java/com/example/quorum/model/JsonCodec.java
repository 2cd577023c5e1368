package com.example.quorum.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for JSON serialization of answers, results and run reports.
 * Also produces the canonical JSON form used to compare structured agent answers.
 */
public class JsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(JsonCodec.class);
    private static final ObjectMapper objectMapper;
    private static final ObjectMapper canonicalMapper;

    static {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        canonicalMapper = new ObjectMapper();
        canonicalMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    private JsonCodec() {
    }

    /**
     * Serializes any model object to a JSON string.
     *
     * @throws SerializationException if serialization fails
     */
    public static String serialize(Object value) {
        try {
            String json = objectMapper.writeValueAsString(value);
            logger.debug("Serialized {}: {}", value.getClass().getSimpleName(), json);
            return json;
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {}", value, e);
            throw new SerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static RunReport deserializeReport(String json) {
        return deserialize(json, RunReport.class);
    }

    public static TaskResult deserializeResult(String json) {
        return deserialize(json, TaskResult.class);
    }

    public static AgentAnswer deserializeAnswer(String json) {
        return deserialize(json, AgentAnswer.class);
    }

    /**
     * Deserializes a JSON string into the given type.
     *
     * @throws SerializationException if the input is null or not valid for the type
     */
    public static <T> T deserialize(String json, Class<T> type) {
        if (json == null) {
            throw new SerializationException("JSON string cannot be null");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize {} from JSON: {}", type.getSimpleName(), json, e);
            throw new SerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * Renders a JSON tree with object keys sorted at every level, so that documents differing
     * only in key order produce identical strings.
     */
    public static String canonicalize(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "null";
        }
        try {
            Object plain = canonicalMapper.treeToValue(node, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to canonicalize JSON payload", e);
        }
    }

    /**
     * Gets the configured ObjectMapper instance for advanced usage.
     */
    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
