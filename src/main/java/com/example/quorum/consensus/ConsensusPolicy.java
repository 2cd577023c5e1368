package com.example.quorum.consensus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Decides per task whether it runs on a single agent or through a consensus round with fault parameter f.
 */
public class ConsensusPolicy {

    /**
     * Override value marking a task as single-agent.
     */
    public static final int SINGLE_AGENT = -1;

    private final int defaultFaultTolerance;
    private final Map<String, Integer> overrides;

    private ConsensusPolicy(int defaultFaultTolerance, Map<String, Integer> overrides) {
        checkFaultTolerance("defaultFaultTolerance", defaultFaultTolerance);
        overrides.forEach((taskId, f) -> checkFaultTolerance("perTaskConsensusOverride." + taskId, f));
        this.defaultFaultTolerance = defaultFaultTolerance;
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    /**
     * Every task runs on one agent.
     */
    public static ConsensusPolicy singleAgent() {
        return new ConsensusPolicy(SINGLE_AGENT, Map.of());
    }

    /**
     * Every task is resolved by consensus over {@code 2f+1} answers.
     */
    public static ConsensusPolicy faultTolerant(int faultTolerance) {
        return new ConsensusPolicy(faultTolerance, Map.of());
    }

    /**
     * @param defaultFaultTolerance f for tasks without an override, or {@link #SINGLE_AGENT}
     * @param overrides task id to f, or to {@link #SINGLE_AGENT}
     */
    public static ConsensusPolicy of(int defaultFaultTolerance, Map<String, Integer> overrides) {
        return new ConsensusPolicy(defaultFaultTolerance, overrides != null ? overrides : Map.of());
    }

    public ConsensusPolicy withOverride(String taskId, int faultTolerance) {
        Map<String, Integer> updated = new LinkedHashMap<>(overrides);
        updated.put(taskId, faultTolerance);
        return new ConsensusPolicy(defaultFaultTolerance, updated);
    }

    public ConsensusPolicy withSingleAgent(String taskId) {
        return withOverride(taskId, SINGLE_AGENT);
    }

    /**
     * Fault parameter for the task, or empty when it runs on a single agent.
     */
    public OptionalInt faultToleranceFor(String taskId) {
        int f = overrides.getOrDefault(taskId, defaultFaultTolerance);
        return f == SINGLE_AGENT ? OptionalInt.empty() : OptionalInt.of(f);
    }

    public boolean requiresConsensus(String taskId) {
        return faultToleranceFor(taskId).isPresent();
    }

    public int getDefaultFaultTolerance() {
        return defaultFaultTolerance;
    }

    public Map<String, Integer> getOverrides() {
        return overrides;
    }

    private static void checkFaultTolerance(String option, int f) {
        if (f < SINGLE_AGENT) {
            throw new IllegalArgumentException(option + " must be >= 0 or none: " + f);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsensusPolicy that = (ConsensusPolicy) o;
        return defaultFaultTolerance == that.defaultFaultTolerance &&
               Objects.equals(overrides, that.overrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultFaultTolerance, overrides);
    }

    @Override
    public String toString() {
        return "ConsensusPolicy{default=" + (defaultFaultTolerance == SINGLE_AGENT ? "none" : defaultFaultTolerance)
            + ", overrides=" + overrides + '}';
    }
}
