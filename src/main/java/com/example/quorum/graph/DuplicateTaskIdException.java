package com.example.quorum.graph;

/**
 * Thrown when a task id is added to a graph twice.
 */
public class DuplicateTaskIdException extends TaskGraphException {

    private final String taskId;

    public DuplicateTaskIdException(String taskId) {
        super("Task id already present in graph: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
