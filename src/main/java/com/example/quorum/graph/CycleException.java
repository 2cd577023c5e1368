package com.example.quorum.graph;

import java.util.List;

/**
 * Thrown when adding a task would introduce a dependency cycle.
 */
public class CycleException extends TaskGraphException {

    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Task ids along the cycle, starting and ending with the same id.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
