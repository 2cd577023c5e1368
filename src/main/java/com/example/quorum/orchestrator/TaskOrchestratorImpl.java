package com.example.quorum.orchestrator;

import com.example.quorum.agent.Agent;
import com.example.quorum.config.RunConfig;
import com.example.quorum.consensus.ConsensusPolicy;
import com.example.quorum.graph.TaskGraph;
import com.example.quorum.model.RunReport;
import com.example.quorum.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs each graph on a dedicated scheduling thread. The orchestrator itself is stateless between runs,
 * so one instance may drive several runs concurrently.
 */
public class TaskOrchestratorImpl implements TaskOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TaskOrchestratorImpl.class);

    private final List<Agent> agents;
    private final ResultSink sink;
    private final RunConfig defaults;

    public TaskOrchestratorImpl(List<? extends Agent> agents) {
        this(agents, ResultSink.NONE, RunConfig.defaults());
    }

    /**
     * @param agents Agent pool used by {@link #run(TaskGraph, int, ConsensusPolicy)}
     * @param sink Sink used by {@link #run(TaskGraph, int, ConsensusPolicy)}
     * @param defaults Settings that {@link #run(TaskGraph, int, ConsensusPolicy)} starts from
     */
    public TaskOrchestratorImpl(List<? extends Agent> agents, ResultSink sink, RunConfig defaults) {
        this.agents = List.copyOf(agents);
        this.sink = sink != null ? sink : ResultSink.NONE;
        this.defaults = defaults != null ? defaults : RunConfig.defaults();
    }

    @Override
    public RunReport run(TaskGraph graph, int concurrency, ConsensusPolicy consensusPolicy) {
        RunConfig config = defaults.toBuilder()
            .concurrency(concurrency)
            .consensusPolicy(consensusPolicy)
            .build();
        RunContext context = RunContext.builder()
            .config(config)
            .agents(agents)
            .sink(sink)
            .build();
        return run(graph, context);
    }

    @Override
    public RunReport run(TaskGraph graph, RunContext context) {
        return start(graph, context).await();
    }

    @Override
    public RunHandle start(TaskGraph graph, RunContext context) {
        graph.prepareForRun();
        RunExecution execution = new RunExecution(graph, context);
        Thread thread = new Thread(execution, "quorum-run-" + context.getRunId());
        thread.start();
        logger.info("Started run {} with {} tasks, concurrency {}, {}",
                    context.getRunId(), graph.size(), context.getConfig().getConcurrency(),
                    context.getConfig().getConsensusPolicy());
        return new RunHandle(context.getRunId(), context.getCancellationToken(), execution.getCompletion(),
                             graph::statusSnapshot);
    }
}
