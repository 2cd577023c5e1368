package com.example.quorum.config;

import com.example.quorum.agent.AgentSelection;
import com.example.quorum.consensus.AnswerCanonicalizer;
import com.example.quorum.consensus.ConsensusPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for one orchestrator run. Build with {@link #builder()}; every option has a default.
 */
public class RunConfig {

    public static final int DEFAULT_CONCURRENCY = 4;
    public static final int DEFAULT_FAULT_TOLERANCE = 1;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_CONSENSUS_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_AGENT_TIMEOUT = Duration.ofSeconds(120);
    public static final AgentSelection DEFAULT_AGENT_SELECTION = AgentSelection.ROTATE;

    private final int concurrency;
    private final ConsensusPolicy consensusPolicy;
    private final int maxRetries;
    private final RetryBackoff retryBackoff;
    private final Duration consensusTimeout;
    private final Duration agentTimeout;
    private final double similarityThreshold;
    private final AgentSelection agentSelection;

    private RunConfig(Builder builder) {
        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be > 0: " + builder.concurrency);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + builder.maxRetries);
        }
        requirePositive("consensusTimeout", builder.consensusTimeout);
        requirePositive("agentTimeout", builder.agentTimeout);
        if (builder.similarityThreshold <= 0.0 || builder.similarityThreshold > 1.0) {
            throw new IllegalArgumentException(
                "similarityThreshold must be in (0, 1]: " + builder.similarityThreshold);
        }
        if (builder.retryBackoff == null) {
            throw new IllegalArgumentException("retryBackoff must be set");
        }
        if (builder.agentSelection == null) {
            throw new IllegalArgumentException("agentSelection must be set");
        }
        this.concurrency = builder.concurrency;
        this.consensusPolicy = ConsensusPolicy.of(builder.defaultFaultTolerance, builder.overrides);
        this.maxRetries = builder.maxRetries;
        this.retryBackoff = builder.retryBackoff;
        this.consensusTimeout = builder.consensusTimeout;
        this.agentTimeout = builder.agentTimeout;
        this.similarityThreshold = builder.similarityThreshold;
        this.agentSelection = builder.agentSelection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RunConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .concurrency(concurrency)
            .defaultFaultTolerance(consensusPolicy.getDefaultFaultTolerance())
            .maxRetries(maxRetries)
            .retryBackoff(retryBackoff)
            .consensusTimeout(consensusTimeout)
            .agentTimeout(agentTimeout)
            .similarityThreshold(similarityThreshold)
            .agentSelection(agentSelection);
        builder.overrides.putAll(consensusPolicy.getOverrides());
        return builder;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public ConsensusPolicy getConsensusPolicy() {
        return consensusPolicy;
    }

    /**
     * Default f, or {@link ConsensusPolicy#SINGLE_AGENT}.
     */
    public int getDefaultFaultTolerance() {
        return consensusPolicy.getDefaultFaultTolerance();
    }

    public Map<String, Integer> getPerTaskConsensusOverride() {
        return consensusPolicy.getOverrides();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public RetryBackoff getRetryBackoff() {
        return retryBackoff;
    }

    public Duration getConsensusTimeout() {
        return consensusTimeout;
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public AgentSelection getAgentSelection() {
        return agentSelection;
    }

    private static void requirePositive(String option, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(option + " must be > 0: " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunConfig that = (RunConfig) o;
        return concurrency == that.concurrency &&
               maxRetries == that.maxRetries &&
               Double.compare(that.similarityThreshold, similarityThreshold) == 0 &&
               Objects.equals(consensusPolicy, that.consensusPolicy) &&
               Objects.equals(retryBackoff, that.retryBackoff) &&
               Objects.equals(consensusTimeout, that.consensusTimeout) &&
               Objects.equals(agentTimeout, that.agentTimeout) &&
               agentSelection == that.agentSelection;
    }

    @Override
    public int hashCode() {
        return Objects.hash(concurrency, consensusPolicy, maxRetries, retryBackoff, consensusTimeout,
                          agentTimeout, similarityThreshold, agentSelection);
    }

    @Override
    public String toString() {
        return "RunConfig{" +
               "concurrency=" + concurrency +
               ", consensusPolicy=" + consensusPolicy +
               ", maxRetries=" + maxRetries +
               ", retryBackoff=" + retryBackoff +
               ", consensusTimeout=" + consensusTimeout +
               ", agentTimeout=" + agentTimeout +
               ", similarityThreshold=" + similarityThreshold +
               ", agentSelection=" + agentSelection +
               '}';
    }

    public static class Builder {
        private int concurrency = DEFAULT_CONCURRENCY;
        private int defaultFaultTolerance = DEFAULT_FAULT_TOLERANCE;
        private final Map<String, Integer> overrides = new LinkedHashMap<>();
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private RetryBackoff retryBackoff = RetryBackoff.defaults();
        private Duration consensusTimeout = DEFAULT_CONSENSUS_TIMEOUT;
        private Duration agentTimeout = DEFAULT_AGENT_TIMEOUT;
        private double similarityThreshold = AnswerCanonicalizer.DEFAULT_SIMILARITY_THRESHOLD;
        private AgentSelection agentSelection = DEFAULT_AGENT_SELECTION;

        private Builder() {
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder defaultFaultTolerance(int faultTolerance) {
            this.defaultFaultTolerance = faultTolerance;
            return this;
        }

        /**
         * Runs tasks without an override on a single agent.
         */
        public Builder singleAgentByDefault() {
            this.defaultFaultTolerance = ConsensusPolicy.SINGLE_AGENT;
            return this;
        }

        public Builder consensusOverride(String taskId, int faultTolerance) {
            this.overrides.put(taskId, faultTolerance);
            return this;
        }

        public Builder singleAgent(String taskId) {
            this.overrides.put(taskId, ConsensusPolicy.SINGLE_AGENT);
            return this;
        }

        public Builder consensusPolicy(ConsensusPolicy policy) {
            this.defaultFaultTolerance = policy.getDefaultFaultTolerance();
            this.overrides.clear();
            this.overrides.putAll(policy.getOverrides());
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBackoff(RetryBackoff retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder consensusTimeout(Duration consensusTimeout) {
            this.consensusTimeout = consensusTimeout;
            return this;
        }

        public Builder agentTimeout(Duration agentTimeout) {
            this.agentTimeout = agentTimeout;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder agentSelection(AgentSelection agentSelection) {
            this.agentSelection = agentSelection;
            return this;
        }

        /**
         * @throws IllegalArgumentException naming the first invalid option
         */
        public RunConfig build() {
            return new RunConfig(this);
        }
    }
}
