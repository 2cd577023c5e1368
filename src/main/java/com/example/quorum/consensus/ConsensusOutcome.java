package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.TaskResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a terminal consensus round.
 */
public class ConsensusOutcome {

    private final String taskId;
    private final int round;
    private final RoundOutcome outcome;
    private final AgentAnswer acceptedAnswer;
    private final String signature;
    private final List<String> supportingAgents;
    private final Map<String, Integer> tally;
    private final int answersReceived;
    private final int answersExpected;
    private final int faultTolerance;

    public ConsensusOutcome(String taskId, int round, RoundOutcome outcome, AgentAnswer acceptedAnswer,
                            String signature, List<String> supportingAgents, Map<String, Integer> tally,
                            int answersReceived, int answersExpected, int faultTolerance) {
        this.taskId = taskId;
        this.round = round;
        this.outcome = outcome;
        this.acceptedAnswer = acceptedAnswer;
        this.signature = signature;
        this.supportingAgents = supportingAgents != null ? List.copyOf(supportingAgents) : List.of();
        this.tally = tally != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tally)) : Map.of();
        this.answersReceived = answersReceived;
        this.answersExpected = answersExpected;
        this.faultTolerance = faultTolerance;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getRound() {
        return round;
    }

    public RoundOutcome getOutcome() {
        return outcome;
    }

    public boolean isAccepted() {
        return outcome == RoundOutcome.ACCEPTED;
    }

    /**
     * Representative answer of the winning bucket, or null unless accepted.
     */
    public AgentAnswer getAcceptedAnswer() {
        return acceptedAnswer;
    }

    public String getSignature() {
        return signature;
    }

    public List<String> getSupportingAgents() {
        return supportingAgents;
    }

    /**
     * Support count per bucket signature, in bucket creation order.
     */
    public Map<String, Integer> getTally() {
        return tally;
    }

    public int getAnswersReceived() {
        return answersReceived;
    }

    public int getAnswersExpected() {
        return answersExpected;
    }

    public int getFaultTolerance() {
        return faultTolerance;
    }

    /**
     * Converts an accepted outcome into the task's result.
     *
     * @throws IllegalStateException if the round was not accepted
     */
    public TaskResult toTaskResult() {
        if (!isAccepted()) {
            throw new IllegalStateException("Round " + round + " for task " + taskId + " ended " + outcome);
        }
        return new TaskResult(
            taskId,
            acceptedAnswer.getContent(),
            acceptedAnswer.getStructuredContent(),
            acceptedAnswer.getAgentId(),
            supportingAgents,
            signature,
            round,
            Instant.now()
        );
    }

    public String describe() {
        return outcome + " in round " + round + " (" + answersReceived + "/" + answersExpected
            + " answers, f=" + faultTolerance + ", tally=" + tally.values() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsensusOutcome that = (ConsensusOutcome) o;
        return round == that.round &&
               answersReceived == that.answersReceived &&
               answersExpected == that.answersExpected &&
               faultTolerance == that.faultTolerance &&
               Objects.equals(taskId, that.taskId) &&
               outcome == that.outcome &&
               Objects.equals(acceptedAnswer, that.acceptedAnswer) &&
               Objects.equals(signature, that.signature) &&
               Objects.equals(supportingAgents, that.supportingAgents) &&
               Objects.equals(tally, that.tally);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, round, outcome, acceptedAnswer, signature, supportingAgents, tally,
                          answersReceived, answersExpected, faultTolerance);
    }

    @Override
    public String toString() {
        return "ConsensusOutcome{" +
               "taskId='" + taskId + '\'' +
               ", round=" + round +
               ", outcome=" + outcome +
               ", signature='" + signature + '\'' +
               ", supportingAgents=" + supportingAgents +
               ", answersReceived=" + answersReceived +
               ", answersExpected=" + answersExpected +
               '}';
    }
}
