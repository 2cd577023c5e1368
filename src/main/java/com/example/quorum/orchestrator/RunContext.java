package com.example.quorum.orchestrator;

import com.example.quorum.agent.Agent;
import com.example.quorum.config.RunConfig;
import com.example.quorum.consensus.ConsensusEngine;
import com.example.quorum.consensus.PluralityConsensusEngine;
import com.example.quorum.sink.ResultSink;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Everything one run needs: configuration, agent pool, result sink, cancellation token and listener.
 * Runs share nothing beyond what their contexts share.
 */
public class RunContext {

    private final String runId;
    private final RunConfig config;
    private final List<Agent> agents;
    private final ResultSink sink;
    private final CancellationToken cancellationToken;
    private final RunListener listener;
    private final ConsensusEngine consensusEngine;

    private RunContext(Builder builder) {
        if (builder.agents.isEmpty()) {
            throw new IllegalArgumentException("agents must not be empty");
        }
        this.runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
        this.config = builder.config != null ? builder.config : RunConfig.defaults();
        this.agents = List.copyOf(builder.agents);
        this.sink = builder.sink != null ? builder.sink : ResultSink.NONE;
        this.cancellationToken = builder.cancellationToken != null ? builder.cancellationToken : new CancellationToken();
        this.listener = builder.listener != null ? builder.listener : RunListener.NONE;
        this.consensusEngine = builder.consensusEngine != null
            ? builder.consensusEngine
            : new PluralityConsensusEngine(this.config.getSimilarityThreshold());
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRunId() {
        return runId;
    }

    public RunConfig getConfig() {
        return config;
    }

    public List<Agent> getAgents() {
        return agents;
    }

    public ResultSink getSink() {
        return sink;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public RunListener getListener() {
        return listener;
    }

    public ConsensusEngine getConsensusEngine() {
        return consensusEngine;
    }

    public static class Builder {
        private String runId;
        private RunConfig config;
        private final List<Agent> agents = new ArrayList<>();
        private ResultSink sink;
        private CancellationToken cancellationToken;
        private RunListener listener;
        private ConsensusEngine consensusEngine;

        private Builder() {
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder config(RunConfig config) {
            this.config = config;
            return this;
        }

        public Builder agent(Agent agent) {
            this.agents.add(agent);
            return this;
        }

        public Builder agents(List<? extends Agent> agents) {
            this.agents.addAll(agents);
            return this;
        }

        public Builder sink(ResultSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Replaces the plurality engine built from the configured similarity threshold.
         */
        public Builder consensusEngine(ConsensusEngine consensusEngine) {
            this.consensusEngine = consensusEngine;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
