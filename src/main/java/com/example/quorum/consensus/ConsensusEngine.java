package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reduces the answers of a fan-out to a single accepted answer, tolerating up to {@code f} faulty agents.
 */
public interface ConsensusEngine {

    /**
     * Resolves a round from answers that have all arrived. Calls missing from {@code answers}
     * (fewer than {@code 2f+1}) count as failed.
     *
     * @param taskId The task the answers belong to
     * @param round 1-based round number, equal to the task's attempt
     * @param answers The answers received
     * @param faultTolerance The number of faulty agents to tolerate
     * @return The terminal outcome of the round
     */
    ConsensusOutcome resolve(String taskId, int round, Collection<AgentAnswer> answers, int faultTolerance);

    /**
     * Resolves a round as answers arrive, completing as soon as the outcome can no longer change.
     * Calls that complete exceptionally or with an empty answer count as failed.
     *
     * @param taskId The task the answers belong to
     * @param round 1-based round number
     * @param calls One future per dispatched agent call
     * @param faultTolerance The number of faulty agents to tolerate
     * @param timeout Deadline for the whole round
     * @return A future completing with the terminal outcome; it never completes exceptionally
     */
    CompletableFuture<ConsensusOutcome> resolve(String taskId, int round,
                                                List<CompletableFuture<AgentAnswer>> calls,
                                                int faultTolerance, Duration timeout);

    default ConsensusOutcome resolve(Collection<AgentAnswer> answers, int faultTolerance) {
        String taskId = answers.isEmpty() ? null : answers.iterator().next().getTaskId();
        return resolve(taskId, 1, answers, faultTolerance);
    }
}
