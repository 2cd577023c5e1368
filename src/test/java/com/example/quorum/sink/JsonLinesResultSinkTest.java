package com.example.quorum.sink;

import com.example.quorum.model.JsonCodec;
import com.example.quorum.model.TaskResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesResultSinkTest {

    @TempDir
    Path tempDir;

    private static TaskResult result(String taskId) {
        return new TaskResult(taskId, "out " + taskId, null, "agent-1", List.of("agent-1", "agent-2"),
            "text:0123456789abcdef", 1, Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void testWritesOneDocumentPerLine() throws IOException {
        Path file = tempDir.resolve("out/results.jsonl");

        try (JsonLinesResultSink sink = new JsonLinesResultSink(file)) {
            sink.accept("a", result("a"));
            sink.accept("b", result("b"));
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertEquals(result("a"), JsonCodec.deserializeResult(lines.get(0)));
        assertEquals("b", JsonCodec.deserializeResult(lines.get(1)).getTaskId());
    }

    @Test
    void testAppendsToExistingFile() throws IOException {
        Path file = tempDir.resolve("results.jsonl");
        try (JsonLinesResultSink sink = new JsonLinesResultSink(file)) {
            sink.accept("a", result("a"));
        }

        try (JsonLinesResultSink sink = new JsonLinesResultSink(file)) {
            sink.accept("b", result("b"));
            assertEquals(file, sink.getPath());
        }

        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    void testFailsAfterClose() throws IOException {
        JsonLinesResultSink sink = new JsonLinesResultSink(tempDir.resolve("closed.jsonl"));
        sink.close();

        assertThrows(UncheckedIOException.class, () -> sink.accept("a", result("a")));
    }
}
