package com.example.quorum.sink;

import com.example.quorum.model.TaskResult;

/**
 * Receives the result of every task that succeeds. Delivery is fire-and-forget: exceptions thrown
 * here are logged by the orchestrator and never affect the run.
 */
@FunctionalInterface
public interface ResultSink {

    /**
     * Sink that discards results.
     */
    ResultSink NONE = (taskId, result) -> { };

    void accept(String taskId, TaskResult result);
}
