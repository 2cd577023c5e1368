package com.example.quorum.graph;

/**
 * Base class for errors detected while building or validating a task graph.
 * These are fatal: a run never starts on an invalid graph.
 */
public class TaskGraphException extends RuntimeException {

    public TaskGraphException(String message) {
        super(message);
    }
}
