package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One bounded attempt to reduce the fan-out answers for a task to a single accepted answer.
 *
 * <p>The round expects {@code 2f+1} answers. A bucket is accepted once its support is at least
 * {@code f+1} and exceeds the runner-up by more than the number of answers still outstanding, so an
 * early acceptance can never be overturned by late answers. With every answer in, that reduces to a
 * strict plurality of at least {@code f+1}.
 *
 * <p>Thread-safe: answers and failures may be reported from agent threads concurrently.
 */
public class ConsensusRound {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusRound.class);

    private final String taskId;
    private final int roundNumber;
    private final int faultTolerance;
    private final int expectedAnswers;
    private final int dispatchedCalls;
    private final AnswerCanonicalizer canonicalizer;

    private final List<AgentAnswer> answers = new ArrayList<>();
    private final List<Bucket> buckets = new ArrayList<>();
    private int failedCalls;
    private RoundOutcome outcome = RoundOutcome.PENDING;
    private Bucket accepted;

    /**
     * Creates a round whose call count equals the required {@code 2f+1} answers.
     */
    public ConsensusRound(String taskId, int roundNumber, int faultTolerance, AnswerCanonicalizer canonicalizer) {
        this(taskId, roundNumber, faultTolerance, requiredAnswers(faultTolerance), canonicalizer);
    }

    public ConsensusRound(String taskId, int roundNumber, int faultTolerance, int dispatchedCalls,
                          AnswerCanonicalizer canonicalizer) {
        if (faultTolerance < 0) {
            throw new IllegalArgumentException("Fault tolerance must be >= 0: " + faultTolerance);
        }
        if (dispatchedCalls < 1) {
            throw new IllegalArgumentException("A round needs at least one call: " + dispatchedCalls);
        }
        this.taskId = taskId;
        this.roundNumber = roundNumber;
        this.faultTolerance = faultTolerance;
        this.expectedAnswers = requiredAnswers(faultTolerance);
        this.dispatchedCalls = dispatchedCalls;
        this.canonicalizer = canonicalizer;
    }

    /**
     * Number of answers a round with fault tolerance {@code f} waits for: {@code 2f+1}.
     */
    public static int requiredAnswers(int faultTolerance) {
        return 2 * faultTolerance + 1;
    }

    /**
     * Plurality a bucket needs to be accepted: {@code f+1}.
     */
    public static int acceptanceThreshold(int faultTolerance) {
        return faultTolerance + 1;
    }

    /**
     * Adds an answer to its bucket and re-evaluates. Answers arriving after the round ended are ignored.
     *
     * @return the outcome after this answer
     */
    public synchronized RoundOutcome offer(AgentAnswer answer) {
        if (outcome.isTerminal()) {
            logger.debug("Ignoring late answer for task {} round {}", taskId, roundNumber);
            return outcome;
        }
        if (answer == null || answer.isEmpty()) {
            return recordFailureLocked();
        }
        answers.add(answer);
        String signature = canonicalizer.signatureOf(answer);
        Bucket home = null;
        for (Bucket bucket : buckets) {
            if (canonicalizer.matches(bucket.representative, bucket.signature, answer, signature)) {
                home = bucket;
                break;
            }
        }
        if (home == null) {
            home = new Bucket(signature, answer);
            buckets.add(home);
        }
        home.supporters.add(answer.getAgentId());
        return evaluate();
    }

    /**
     * Records a call that ended without a usable answer.
     *
     * @return the outcome after this failure
     */
    public synchronized RoundOutcome recordFailure() {
        if (outcome.isTerminal()) {
            return outcome;
        }
        return recordFailureLocked();
    }

    /**
     * Treats every outstanding call as failed and settles the round.
     */
    public synchronized RoundOutcome settle() {
        if (!outcome.isTerminal()) {
            failedCalls = dispatchedCalls - answers.size();
            evaluate();
        }
        return outcome;
    }

    /**
     * Ends a still-pending round at its deadline.
     */
    public synchronized RoundOutcome expire() {
        if (!outcome.isTerminal()) {
            outcome = RoundOutcome.TIMED_OUT;
            logger.debug("Round {} for task {} timed out with {}/{} answers",
                         roundNumber, taskId, answers.size(), expectedAnswers);
        }
        return outcome;
    }

    public synchronized RoundOutcome getOutcome() {
        return outcome;
    }

    public synchronized List<AgentAnswer> getAnswers() {
        return Collections.unmodifiableList(new ArrayList<>(answers));
    }

    /**
     * Support count per bucket signature, in bucket creation order.
     */
    public synchronized Map<String, Integer> tally() {
        Map<String, Integer> tally = new LinkedHashMap<>();
        for (Bucket bucket : buckets) {
            tally.put(bucket.signature, bucket.supporters.size());
        }
        return tally;
    }

    public synchronized ConsensusOutcome toOutcome() {
        return new ConsensusOutcome(
            taskId,
            roundNumber,
            outcome,
            accepted != null ? accepted.representative : null,
            accepted != null ? accepted.signature : null,
            accepted != null ? accepted.supporters : List.of(),
            tally(),
            answers.size(),
            expectedAnswers,
            faultTolerance
        );
    }

    public String getTaskId() {
        return taskId;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public int getFaultTolerance() {
        return faultTolerance;
    }

    public int getExpectedAnswers() {
        return expectedAnswers;
    }

    private RoundOutcome recordFailureLocked() {
        failedCalls++;
        return evaluate();
    }

    private RoundOutcome evaluate() {
        Bucket leader = null;
        int runnerUp = 0;
        for (Bucket bucket : buckets) {
            int support = bucket.supporters.size();
            if (leader == null || support > leader.supporters.size()) {
                if (leader != null) {
                    runnerUp = leader.supporters.size();
                }
                leader = bucket;
            } else if (support > runnerUp) {
                runnerUp = support;
            }
        }
        int outstanding = Math.max(0, dispatchedCalls - answers.size() - failedCalls);
        int leaderSupport = leader != null ? leader.supporters.size() : 0;

        if (leader != null && leaderSupport >= acceptanceThreshold(faultTolerance)
                && leaderSupport > runnerUp + outstanding) {
            outcome = RoundOutcome.ACCEPTED;
            accepted = leader;
        } else if (outstanding == 0) {
            outcome = answers.size() >= expectedAnswers ? RoundOutcome.NO_QUORUM : RoundOutcome.TIMED_OUT;
        }
        return outcome;
    }

    private static final class Bucket {
        private final String signature;
        private final AgentAnswer representative;
        private final List<String> supporters = new ArrayList<>();

        private Bucket(String signature, AgentAnswer representative) {
            this.signature = signature;
            this.representative = representative;
        }
    }
}
