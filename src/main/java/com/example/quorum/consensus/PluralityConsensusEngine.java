package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Plurality voting over canonicalized answers: a bucket with at least {@code f+1} supporters and no
 * possible challenger wins.
 */
public class PluralityConsensusEngine implements ConsensusEngine {

    private static final Logger logger = LoggerFactory.getLogger(PluralityConsensusEngine.class);

    private static final ScheduledExecutorService SHARED_DEADLINES = deadlineScheduler();

    private final AnswerCanonicalizer canonicalizer;
    private final ScheduledExecutorService deadlines;

    public PluralityConsensusEngine() {
        this(new AnswerCanonicalizer());
    }

    public PluralityConsensusEngine(double similarityThreshold) {
        this(new AnswerCanonicalizer(similarityThreshold));
    }

    public PluralityConsensusEngine(AnswerCanonicalizer canonicalizer) {
        this(canonicalizer, SHARED_DEADLINES);
    }

    /**
     * @param deadlines scheduler for round timeouts; a deadline is cancelled as soon as its round settles
     */
    public PluralityConsensusEngine(AnswerCanonicalizer canonicalizer, ScheduledExecutorService deadlines) {
        this.canonicalizer = canonicalizer;
        this.deadlines = deadlines;
    }

    /**
     * Single daemon thread that drops cancelled deadlines from its queue.
     */
    public static ScheduledThreadPoolExecutor deadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "consensus-deadline");
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Override
    public ConsensusOutcome resolve(String taskId, int round, Collection<AgentAnswer> answers, int faultTolerance) {
        int expected = ConsensusRound.requiredAnswers(faultTolerance);
        ConsensusRound consensusRound = new ConsensusRound(
            taskId, round, faultTolerance, Math.max(expected, answers.size()), canonicalizer);
        for (AgentAnswer answer : answers) {
            consensusRound.offer(answer);
        }
        consensusRound.settle();
        ConsensusOutcome outcome = consensusRound.toOutcome();
        logger.debug("Task {} {}", taskId, outcome.describe());
        return outcome;
    }

    @Override
    public CompletableFuture<ConsensusOutcome> resolve(String taskId, int round,
                                                       List<CompletableFuture<AgentAnswer>> calls,
                                                       int faultTolerance, Duration timeout) {
        CompletableFuture<ConsensusOutcome> result = new CompletableFuture<>();
        if (calls.isEmpty()) {
            ConsensusRound empty = new ConsensusRound(taskId, round, faultTolerance, canonicalizer);
            empty.settle();
            result.complete(empty.toOutcome());
            return result;
        }

        ConsensusRound consensusRound = new ConsensusRound(taskId, round, faultTolerance, calls.size(), canonicalizer);
        for (CompletableFuture<AgentAnswer> call : calls) {
            call.whenComplete((answer, error) -> {
                RoundOutcome outcome;
                if (error != null) {
                    logger.debug("Agent call for task {} round {} failed: {}", taskId, round, error.toString());
                    outcome = consensusRound.recordFailure();
                } else {
                    outcome = consensusRound.offer(answer);
                }
                if (outcome.isTerminal()) {
                    result.complete(consensusRound.toOutcome());
                }
            });
        }

        if (!result.isDone()) {
            ScheduledFuture<?> deadline = deadlines.schedule(() -> {
                if (!result.isDone()) {
                    consensusRound.expire();
                    result.complete(consensusRound.toOutcome());
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            result.whenComplete((outcome, error) -> deadline.cancel(false));
        }
        return result;
    }

    public AnswerCanonicalizer getCanonicalizer() {
        return canonicalizer;
    }
}
