package com.example.quorum.plan;

import com.example.quorum.graph.CycleException;
import com.example.quorum.graph.Task;
import com.example.quorum.graph.TaskGraph;
import com.example.quorum.graph.UnknownDependencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaskPlanParser functionality.
 */
class TaskPlanParserTest {

    private TaskPlanParser parser;

    @BeforeEach
    void setUp() {
        parser = new TaskPlanParser();
    }

    @Test
    @DisplayName("Should build a graph from a plan embedded in prose")
    void shouldParseEmbeddedPlan() {
        String plan = "Here is the plan:\n"
            + "[{\"id\": \"1\", \"description\": \"Design schema\", \"dependencies\": [], \"priority\": 2},\n"
            + " {\"id\": \"2\", \"description\": \"Write migrations\", \"dependencies\": [\"1\"], \"maxRetries\": 0,\n"
            + "  \"attributes\": {\"role\": \"coder\"}, \"payload\": {\"tables\": 3}}]\n"
            + "Let me know if you need changes.";

        TaskGraph graph = parser.parse(plan);

        assertEquals(2, graph.size());
        Task schema = graph.get("1");
        Task migrations = graph.get("2");
        assertEquals(2, schema.getPriority());
        assertEquals("Design schema", schema.getSpec().getDescription());
        assertEquals(List.of("1"), List.copyOf(migrations.getDependencies()));
        assertEquals(Integer.valueOf(0), migrations.getMaxRetries());
        assertEquals(Map.of("role", "coder"), migrations.getSpec().getAttributes());
        assertEquals(3, migrations.getSpec().getPayload().get("tables").asInt());
        assertNull(schema.getMaxRetries());
    }

    @Test
    @DisplayName("Should number entries without ids by position and accept numeric ids")
    void shouldAssignIds() {
        TaskGraph graph = parser.parse("[{\"description\": \"a\"}, {\"id\": 7, \"description\": \"b\", \"dependencies\": [1]}]");

        assertEquals(List.of("1", "7"), graph.tasks().stream().map(Task::getId).collect(Collectors.toList()));
        assertEquals(List.of("1"), List.copyOf(graph.get("7").getDependencies()));
    }

    @Test
    @DisplayName("Should fall back to a single task when no plan is present")
    void shouldFallBackToSingleTask() {
        TaskGraph graph = parser.parse("  Just summarise the report.  ");

        assertEquals(1, graph.size());
        assertEquals("Just summarise the report.", graph.get(TaskPlanParser.FALLBACK_TASK_ID).getSpec().getDescription());
    }

    @Test
    @DisplayName("Should fall back when the array is not valid JSON")
    void shouldFallBackOnMalformedJson() {
        TaskGraph graph = parser.parse("Steps: [first, second]");

        assertEquals(1, graph.size());
        assertTrue(graph.contains(TaskPlanParser.FALLBACK_TASK_ID));
    }

    @Test
    @DisplayName("Should reject plans with dangling dependencies or cycles")
    void shouldRejectInvalidPlans() {
        assertThrows(UnknownDependencyException.class,
            () -> parser.parse("[{\"id\": \"a\", \"dependencies\": [\"b\"]}]"));
        assertThrows(CycleException.class,
            () -> parser.parse("[{\"id\": \"a\", \"dependencies\": [\"b\"]}, {\"id\": \"b\", \"dependencies\": [\"a\"]}]"));
    }
}
