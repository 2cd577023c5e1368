package com.example.quorum.graph;

/**
 * Thrown at validation when a task depends on an id that was never added to the graph.
 */
public class UnknownDependencyException extends TaskGraphException {

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super("Task " + taskId + " depends on unknown task " + dependencyId);
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
