package com.example.quorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque description of the work a task asks an agent to do.
 * The orchestrator never interprets it; agents turn it into prompts.
 */
public class TaskSpec {

    private final String description;
    private final JsonNode payload;
    private final Map<String, String> attributes;
    private final List<String> context;

    @JsonCreator
    public TaskSpec(
            @JsonProperty("description") String description,
            @JsonProperty("payload") JsonNode payload,
            @JsonProperty("attributes") Map<String, String> attributes,
            @JsonProperty("context") List<String> context) {
        this.description = description != null ? description : "";
        this.payload = payload;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        this.context = context != null ? List.copyOf(context) : List.of();
    }

    public static TaskSpec of(String description) {
        return new TaskSpec(description, null, null, null);
    }

    public static TaskSpec structured(String description, JsonNode payload) {
        return new TaskSpec(description, payload, null, null);
    }

    public String getDescription() {
        return description;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Results of completed dependencies, in dependency order.
     */
    public List<String> getContext() {
        return context;
    }

    /**
     * Returns a copy of this spec carrying the given dependency results as context.
     */
    public TaskSpec withContext(List<String> dependencyResults) {
        List<String> merged = new ArrayList<>(context);
        if (dependencyResults != null) {
            merged.addAll(dependencyResults);
        }
        return new TaskSpec(description, payload, attributes, merged);
    }

    /**
     * Renders the task as a plain prompt: completed dependency output first, then the work itself.
     */
    @JsonIgnore
    public String toPrompt() {
        StringBuilder prompt = new StringBuilder();
        for (String completed : context) {
            prompt.append("Completed: ").append(completed).append('\n');
        }
        if (prompt.length() > 0) {
            prompt.append("\nNow do: ");
        }
        prompt.append(description);
        if (payload != null && !payload.isNull()) {
            prompt.append("\n\nInput:\n").append(payload.toString());
        }
        return prompt.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskSpec taskSpec = (TaskSpec) o;
        return Objects.equals(description, taskSpec.description) &&
               Objects.equals(payload, taskSpec.payload) &&
               Objects.equals(attributes, taskSpec.attributes) &&
               Objects.equals(context, taskSpec.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, payload, attributes, context);
    }

    @Override
    public String toString() {
        return "TaskSpec{" +
               "description='" + description + '\'' +
               ", payload=" + payload +
               ", attributes=" + attributes +
               ", contextItems=" + context.size() +
               '}';
    }
}
