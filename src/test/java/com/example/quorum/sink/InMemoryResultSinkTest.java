package com.example.quorum.sink;

import com.example.quorum.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryResultSinkTest {

    private static TaskResult result(String taskId, String content) {
        return new TaskResult(taskId, content, null, "agent-1", List.of("agent-1"), null, 0, Instant.now());
    }

    @Test
    void testKeepsArrivalOrder() {
        InMemoryResultSink sink = new InMemoryResultSink();

        sink.accept("b", result("b", "second"));
        sink.accept("a", result("a", "first"));

        assertEquals(List.of("b", "a"), sink.getArrivalOrder());
        assertEquals(2, sink.size());
        assertEquals("first", sink.get("a").map(TaskResult::getContent).orElse(null));
        assertEquals(Optional.empty(), sink.get("missing"));
    }

    @Test
    void testSnapshotIsDetached() {
        InMemoryResultSink sink = new InMemoryResultSink();
        sink.accept("a", result("a", "x"));

        Map<String, TaskResult> snapshot = sink.getResults();
        sink.clear();

        assertEquals(1, snapshot.size());
        assertEquals(0, sink.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("a"));
    }
}
