package com.example.quorum.sink;

import com.example.quorum.model.TaskResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps results in arrival order. Thread-safe.
 */
public class InMemoryResultSink implements ResultSink {

    private final Map<String, TaskResult> results = new LinkedHashMap<>();

    @Override
    public synchronized void accept(String taskId, TaskResult result) {
        results.put(taskId, result);
    }

    public synchronized Optional<TaskResult> get(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    /**
     * Snapshot of all results keyed by task id, in arrival order.
     */
    public synchronized Map<String, TaskResult> getResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Task ids in the order their results arrived.
     */
    public synchronized List<String> getArrivalOrder() {
        return List.copyOf(results.keySet());
    }

    public synchronized int size() {
        return results.size();
    }

    public synchronized void clear() {
        results.clear();
    }
}
