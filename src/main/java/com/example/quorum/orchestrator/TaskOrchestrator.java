package com.example.quorum.orchestrator;

import com.example.quorum.consensus.ConsensusPolicy;
import com.example.quorum.graph.TaskGraph;
import com.example.quorum.model.RunReport;

/**
 * Executes a task graph against a pool of agents, resolving consensus tasks by quorum.
 */
public interface TaskOrchestrator {

    /**
     * Runs the graph with the orchestrator's default agents and settings, overriding concurrency and
     * the consensus policy.
     *
     * @param graph The graph to run; it must not have been run before
     * @param concurrency Maximum number of tasks in flight
     * @param consensusPolicy Which tasks need consensus and with what fault tolerance
     * @return The report once every task is terminal
     * @throws com.example.quorum.graph.TaskGraphException if the graph is invalid
     * @throws IllegalStateException if the graph was already run
     */
    RunReport run(TaskGraph graph, int concurrency, ConsensusPolicy consensusPolicy);

    /**
     * Runs the graph with the given context, blocking until every task is terminal.
     */
    RunReport run(TaskGraph graph, RunContext context);

    /**
     * Starts the graph on its own scheduling thread. Graph validation happens before this returns.
     *
     * @return A handle to await or cancel the run
     */
    RunHandle start(TaskGraph graph, RunContext context);
}
