package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusRoundTest {

    private static final String TASK_ID = "task-1";

    private final AnswerCanonicalizer canonicalizer = new AnswerCanonicalizer();
    private final ObjectMapper mapper = new ObjectMapper();

    private ConsensusRound round(int f) {
        return new ConsensusRound(TASK_ID, 1, f, canonicalizer);
    }

    private static AgentAnswer text(String agentId, String content) {
        return AgentAnswer.text(TASK_ID, agentId, content);
    }

    @Nested
    @DisplayName("Plurality voting")
    class PluralityVoting {

        @Test
        @DisplayName("Should accept X from X, X, Y with f=1")
        void shouldAcceptMajority() {
            ConsensusRound round = round(1);

            round.offer(text("a1", "X"));
            round.offer(text("a2", "Y"));
            RoundOutcome outcome = round.offer(text("a3", "X"));

            assertEquals(RoundOutcome.ACCEPTED, outcome);
            ConsensusOutcome result = round.toOutcome();
            assertEquals("X", result.getAcceptedAnswer().getContent());
            assertEquals(List.of("a1", "a3"), result.getSupportingAgents());
            assertEquals(3, result.getAnswersReceived());
            assertEquals(3, result.getAnswersExpected());
        }

        @Test
        @DisplayName("Should report NO_QUORUM for X, Y, Z with f=1")
        void shouldRejectThreeWaySplit() {
            ConsensusRound round = round(1);

            round.offer(text("a1", "alpha"));
            round.offer(text("a2", "bravo"));
            RoundOutcome outcome = round.offer(text("a3", "charlie"));

            assertEquals(RoundOutcome.NO_QUORUM, outcome);
            assertEquals(3, round.tally().size());
            assertNull(round.toOutcome().getAcceptedAnswer());
            assertThrows(IllegalStateException.class, () -> round.toOutcome().toTaskResult());
        }

        @Test
        @DisplayName("Should accept a single answer when f=0")
        void shouldAcceptSingleAnswerWithoutFaultTolerance() {
            ConsensusRound round = round(0);

            assertEquals(1, round.getExpectedAnswers());
            assertEquals(RoundOutcome.ACCEPTED, round.offer(text("a1", "anything")));
        }

        @Test
        @DisplayName("Should report NO_QUORUM on a tie between two buckets with f=2")
        void shouldRejectTie() {
            ConsensusRound round = round(2);

            round.offer(text("a1", "X"));
            round.offer(text("a2", "X"));
            round.offer(text("a3", "Y"));
            round.offer(text("a4", "Y"));
            RoundOutcome outcome = round.offer(text("a5", "Z"));

            assertEquals(RoundOutcome.NO_QUORUM, outcome);
        }

        @Test
        @DisplayName("Should count repeated votes from the same agent")
        void shouldCountVotesNotAgents() {
            ConsensusRound round = round(1);

            round.offer(text("a1", "X"));
            RoundOutcome outcome = round.offer(text("a1", "X"));

            assertEquals(RoundOutcome.ACCEPTED, outcome);
            assertEquals(List.of("a1", "a1"), round.toOutcome().getSupportingAgents());
        }

        @Test
        @DisplayName("Should bucket structured answers regardless of key order")
        void shouldMatchStructuredAnswersCanonically() throws Exception {
            ConsensusRound round = round(1);

            round.offer(AgentAnswer.structured(TASK_ID, "a1", mapper.readTree("{\"b\":2,\"a\":{\"y\":1,\"x\":0}}")));
            RoundOutcome outcome = round.offer(
                AgentAnswer.structured(TASK_ID, "a2", mapper.readTree("{\"a\":{\"x\":0,\"y\":1},\"b\":2}")));

            assertEquals(RoundOutcome.ACCEPTED, outcome);
            assertTrue(round.toOutcome().getSignature().startsWith("json:"));
        }

        @Test
        @DisplayName("Should not bucket structured and text answers together")
        void shouldKeepStructuredAndTextApart() throws Exception {
            ConsensusRound round = round(1);

            round.offer(AgentAnswer.structured(TASK_ID, "a1", mapper.readTree("{\"a\":1}")));
            round.offer(text("a2", "{\"a\":1}"));

            assertEquals(2, round.tally().size());
        }

        @Test
        @DisplayName("Should group paraphrases by embedding similarity")
        void shouldGroupByEmbedding() {
            ConsensusRound round = round(1);
            AgentAnswer first = new AgentAnswer(TASK_ID, "a1", null, "The answer is four",
                null, new double[]{1.0, 0.0, 0.1}, 1.0, Instant.now());
            AgentAnswer second = new AgentAnswer(TASK_ID, "a2", null, "It equals 4",
                null, new double[]{0.98, 0.02, 0.12}, 1.0, Instant.now());

            round.offer(first);
            RoundOutcome outcome = round.offer(second);

            assertEquals(RoundOutcome.ACCEPTED, outcome);
            assertEquals("The answer is four", round.toOutcome().getAcceptedAnswer().getContent());
        }
    }

    @Nested
    @DisplayName("Early acceptance and settlement")
    class EarlyAcceptance {

        @Test
        @DisplayName("Should accept before all answers arrive once the lead is safe")
        void shouldAcceptEarly() {
            ConsensusRound round = round(1);

            assertEquals(RoundOutcome.PENDING, round.offer(text("a1", "X")));
            assertEquals(RoundOutcome.ACCEPTED, round.offer(text("a2", "X")));
            assertEquals(2, round.toOutcome().getAnswersReceived());
        }

        @Test
        @DisplayName("Should wait while outstanding calls could still overturn the lead")
        void shouldNotAcceptOverturnableLead() {
            ConsensusRound round = new ConsensusRound(TASK_ID, 1, 1, 5, canonicalizer);

            round.offer(text("a1", "X"));
            round.offer(text("a2", "Y"));
            assertEquals(RoundOutcome.PENDING, round.offer(text("a3", "X")));
            assertEquals(RoundOutcome.ACCEPTED, round.offer(text("a4", "X")));
            assertEquals(List.of("a1", "a3", "a4"), round.toOutcome().getSupportingAgents());
        }

        @Test
        @DisplayName("Should ignore answers after the round ended")
        void shouldIgnoreLateAnswers() {
            ConsensusRound round = round(1);
            round.offer(text("a1", "X"));
            round.offer(text("a2", "X"));

            assertEquals(RoundOutcome.ACCEPTED, round.offer(text("a3", "Y")));
            assertEquals(1, round.tally().size());
        }

        @Test
        @DisplayName("Should time out once every call settled without enough answers")
        void shouldTimeOutWhenCallsFail() {
            ConsensusRound round = round(1);

            round.offer(text("a1", "X"));
            round.recordFailure();
            RoundOutcome outcome = round.recordFailure();

            assertEquals(RoundOutcome.TIMED_OUT, outcome);
        }

        @Test
        @DisplayName("Should count empty answers as failed calls")
        void shouldTreatEmptyAnswersAsFailures() {
            ConsensusRound round = round(1);

            round.offer(text("a1", " "));
            round.offer(text("a2", ""));
            RoundOutcome outcome = round.offer(text("a3", "X"));

            assertEquals(RoundOutcome.TIMED_OUT, outcome);
            assertEquals(1, round.getAnswers().size());
        }

        @Test
        @DisplayName("Should still accept when failures cannot change the result")
        void shouldAcceptDespiteFailure() {
            ConsensusRound round = round(1);

            round.recordFailure();
            round.offer(text("a2", "X"));

            assertEquals(RoundOutcome.ACCEPTED, round.offer(text("a3", "X")));
        }

        @Test
        @DisplayName("Should expire a pending round")
        void shouldExpire() {
            ConsensusRound round = round(1);
            round.offer(text("a1", "X"));

            assertEquals(RoundOutcome.TIMED_OUT, round.expire());
            assertEquals(RoundOutcome.TIMED_OUT, round.offer(text("a2", "X")));
        }

        @Test
        @DisplayName("Should not expire a round that already ended")
        void shouldKeepTerminalOutcome() {
            ConsensusRound round = round(0);
            round.offer(text("a1", "X"));

            assertEquals(RoundOutcome.ACCEPTED, round.expire());
        }
    }

    @Test
    void testRejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new ConsensusRound(TASK_ID, 1, -1, canonicalizer));
        assertThrows(IllegalArgumentException.class, () -> new ConsensusRound(TASK_ID, 1, 1, 0, canonicalizer));
        assertEquals(5, ConsensusRound.requiredAnswers(2));
        assertEquals(3, ConsensusRound.acceptanceThreshold(2));
    }
}
