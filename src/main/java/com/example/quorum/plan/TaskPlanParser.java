package com.example.quorum.plan;

import com.example.quorum.graph.Task;
import com.example.quorum.graph.TaskGraph;
import com.example.quorum.model.JsonCodec;
import com.example.quorum.model.TaskSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link TaskGraph} from a decomposition plan produced by a planner model.
 *
 * <p>The plan is a JSON array, possibly surrounded by prose:
 * <pre>
 * [{"id": "1", "description": "...", "dependencies": [], "priority": 1}]
 * </pre>
 * Optional per-entry fields are {@code maxRetries}, {@code payload} and {@code attributes}. Text that
 * holds no parsable array becomes a single task {@code "1"} whose description is the whole text.
 */
public class TaskPlanParser {

    private static final Logger logger = LoggerFactory.getLogger(TaskPlanParser.class);

    public static final String FALLBACK_TASK_ID = "1";

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[.*\\]", Pattern.DOTALL);

    /**
     * @throws com.example.quorum.graph.TaskGraphException if the plan has duplicate ids or a cycle
     */
    public TaskGraph parse(String plan) {
        List<JsonNode> entries = extractEntries(plan);
        TaskGraph graph = new TaskGraph();
        if (entries.isEmpty()) {
            logger.info("No task plan found; running the whole request as task {}", FALLBACK_TASK_ID);
            graph.addTask(new Task(FALLBACK_TASK_ID, 0, TaskSpec.of(plan == null ? "" : plan.trim())));
            return graph;
        }

        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            String id = entry.hasNonNull("id") ? entry.get("id").asText() : String.valueOf(i + 1);
            int priority = entry.path("priority").asInt(0);
            Integer maxRetries = entry.hasNonNull("maxRetries") ? entry.get("maxRetries").asInt() : null;
            JsonNode payload = entry.hasNonNull("payload") ? entry.get("payload") : null;
            TaskSpec spec = new TaskSpec(entry.path("description").asText(""), payload, attributes(entry), List.of());

            List<String> dependencies = new ArrayList<>();
            for (JsonNode dependency : entry.path("dependencies")) {
                dependencies.add(dependency.asText());
            }
            graph.addTask(new Task(id, priority, spec, maxRetries), dependencies);
        }
        graph.validate();
        logger.debug("Parsed task plan with {} tasks", graph.size());
        return graph;
    }

    private List<JsonNode> extractEntries(String plan) {
        if (plan == null) {
            return List.of();
        }
        Matcher matcher = JSON_ARRAY.matcher(plan);
        if (!matcher.find()) {
            return List.of();
        }
        JsonNode array;
        try {
            array = JsonCodec.getObjectMapper().readTree(matcher.group());
        } catch (JsonProcessingException e) {
            logger.warn("Task plan is not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        List<JsonNode> entries = new ArrayList<>();
        for (JsonNode entry : array) {
            if (entry.isObject()) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static Map<String, String> attributes(JsonNode entry) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.path("attributes").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            attributes.put(field.getKey(), field.getValue().asText());
        }
        return attributes;
    }
}
