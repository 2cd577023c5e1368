package com.example.quorum.sink;

import com.example.quorum.model.JsonCodec;
import com.example.quorum.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON document per result to a file, in the {@link TaskResult} wire format.
 */
public class JsonLinesResultSink implements ResultSink, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesResultSink.class);

    private final Path path;
    private final BufferedWriter writer;

    public JsonLinesResultSink(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        logger.debug("Writing results to {}", path);
    }

    @Override
    public synchronized void accept(String taskId, TaskResult result) {
        String line = JsonCodec.serialize(result);
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result of task " + taskId + " to " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
