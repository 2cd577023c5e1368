package com.example.quorum.config;

import com.example.quorum.agent.AgentSelection;
import com.example.quorum.consensus.ConsensusPolicy;
import com.example.quorum.model.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Reads {@link RunConfig} from JSON documents or {@code quorum.}-prefixed properties.
 *
 * <p>Durations are ISO-8601 strings ({@code "PT30S"}) or milliseconds. Fault tolerance values are
 * integers or {@code "none"} for single-agent execution.
 */
public final class RunConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RunConfigLoader.class);

    public static final String PREFIX = "quorum.";
    static final String CONSENSUS_OVERRIDE_PREFIX = PREFIX + "consensus.";

    private static final String NONE = "none";
    private static final Set<String> JSON_FIELDS = Set.of(
        "concurrency", "defaultFaultTolerance", "perTaskConsensusOverride", "maxRetries", "retryBackoff",
        "consensusTimeout", "agentTimeout", "similarityThreshold", "agentSelection");

    private RunConfigLoader() {
    }

    public static RunConfig fromJson(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or an option is invalid
     */
    public static RunConfig fromJson(String json) {
        JsonNode root;
        try {
            root = JsonCodec.getObjectMapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed run configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Run configuration must be a JSON object");
        }

        RunConfig.Builder builder = RunConfig.builder();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!JSON_FIELDS.contains(name)) {
                logger.warn("Ignoring unknown run configuration option: {}", name);
            }
        }
        if (root.has("concurrency")) {
            builder.concurrency(intValue("concurrency", root.get("concurrency")));
        }
        if (root.has("defaultFaultTolerance")) {
            builder.defaultFaultTolerance(faultTolerance("defaultFaultTolerance", root.get("defaultFaultTolerance")));
        }
        JsonNode overrides = root.path("perTaskConsensusOverride");
        if (overrides.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.consensusOverride(field.getKey(),
                    faultTolerance("perTaskConsensusOverride." + field.getKey(), field.getValue()));
            }
        } else if (!overrides.isMissingNode() && !overrides.isNull()) {
            throw new IllegalArgumentException("perTaskConsensusOverride must be an object");
        }
        if (root.has("maxRetries")) {
            builder.maxRetries(intValue("maxRetries", root.get("maxRetries")));
        }
        JsonNode backoff = root.path("retryBackoff");
        if (backoff.isObject()) {
            RetryBackoff defaults = RetryBackoff.defaults();
            builder.retryBackoff(new RetryBackoff(
                backoff.has("base") ? duration("retryBackoff.base", backoff.get("base")) : defaults.getBase(),
                backoff.has("multiplier")
                    ? doubleValue("retryBackoff.multiplier", backoff.get("multiplier")) : defaults.getMultiplier(),
                backoff.has("max") ? duration("retryBackoff.max", backoff.get("max")) : defaults.getMax()));
        }
        if (root.has("consensusTimeout")) {
            builder.consensusTimeout(duration("consensusTimeout", root.get("consensusTimeout")));
        }
        if (root.has("agentTimeout")) {
            builder.agentTimeout(duration("agentTimeout", root.get("agentTimeout")));
        }
        if (root.has("similarityThreshold")) {
            builder.similarityThreshold(doubleValue("similarityThreshold", root.get("similarityThreshold")));
        }
        if (root.has("agentSelection")) {
            builder.agentSelection(agentSelection(root.get("agentSelection").asText()));
        }
        return builder.build();
    }

    /**
     * Loads a properties file, letting system properties override its values.
     */
    public static RunConfig fromProperties(Path path) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from {@code quorum.}-prefixed keys. System properties with the same
     * keys take precedence over the given values.
     */
    public static RunConfig fromProperties(Properties source) {
        Properties merged = new Properties();
        merged.putAll(source);
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                merged.setProperty(key, System.getProperty(key));
            }
        }

        RunConfig.Builder builder = RunConfig.builder();
        RetryBackoff defaults = RetryBackoff.defaults();
        Duration base = defaults.getBase();
        double multiplier = defaults.getMultiplier();
        Duration max = defaults.getMax();

        for (String key : merged.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String value = merged.getProperty(key).trim();
            if (key.startsWith(CONSENSUS_OVERRIDE_PREFIX)) {
                builder.consensusOverride(key.substring(CONSENSUS_OVERRIDE_PREFIX.length()),
                    faultTolerance(key, value));
                continue;
            }
            switch (key.substring(PREFIX.length())) {
                case "concurrency":
                    builder.concurrency(parseInt(key, value));
                    break;
                case "defaultFaultTolerance":
                    builder.defaultFaultTolerance(faultTolerance(key, value));
                    break;
                case "maxRetries":
                    builder.maxRetries(parseInt(key, value));
                    break;
                case "retryBackoff.base":
                    base = parseDuration(key, value);
                    break;
                case "retryBackoff.multiplier":
                    multiplier = parseDouble(key, value);
                    break;
                case "retryBackoff.max":
                    max = parseDuration(key, value);
                    break;
                case "consensusTimeout":
                    builder.consensusTimeout(parseDuration(key, value));
                    break;
                case "agentTimeout":
                    builder.agentTimeout(parseDuration(key, value));
                    break;
                case "similarityThreshold":
                    builder.similarityThreshold(parseDouble(key, value));
                    break;
                case "agentSelection":
                    builder.agentSelection(agentSelection(value));
                    break;
                default:
                    logger.warn("Ignoring unknown run configuration property: {}", key);
            }
        }
        builder.retryBackoff(new RetryBackoff(base, multiplier, max));
        return builder.build();
    }

    private static int intValue(String option, JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.intValue();
        }
        return parseInt(option, node.asText());
    }

    private static double doubleValue(String option, JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return parseDouble(option, node.asText());
    }

    private static int faultTolerance(String option, JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.intValue();
        }
        return faultTolerance(option, node.asText());
    }

    private static int faultTolerance(String option, String value) {
        if (NONE.equalsIgnoreCase(value.trim())) {
            return ConsensusPolicy.SINGLE_AGENT;
        }
        int f = parseInt(option, value);
        if (f < 0) {
            throw new IllegalArgumentException(option + " must be >= 0 or none: " + value);
        }
        return f;
    }

    private static Duration duration(String option, JsonNode node) {
        if (node.isIntegralNumber()) {
            return Duration.ofMillis(node.longValue());
        }
        return parseDuration(option, node.asText());
    }

    static Duration parseDuration(String option, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit) && !trimmed.isEmpty()) {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(option + " is not a duration: " + value, e);
        }
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " is not a number: " + value, e);
        }
    }

    private static AgentSelection agentSelection(String value) {
        try {
            return AgentSelection.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("agentSelection must be REUSE or ROTATE: " + value, e);
        }
    }
}
