package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityScorerTest {

    @Test
    void testCosineOfIdenticalAndOrthogonalVectors() {
        assertEquals(1.0, SimilarityScorer.cosine(new double[]{1, 2, 3}, new double[]{2, 4, 6}), 1e-9);
        assertEquals(0.0, SimilarityScorer.cosine(new double[]{1, 0}, new double[]{0, 1}), 1e-9);
        assertEquals(0.0, SimilarityScorer.cosine(new double[]{1, 0}, new double[]{-1, 0}), 1e-9);
        assertEquals(0.0, SimilarityScorer.cosine(new double[]{0, 0}, new double[]{1, 1}), 1e-9);
    }

    @Test
    void testCosineRejectsMismatchedDimensions() {
        assertThrows(IllegalArgumentException.class,
            () -> SimilarityScorer.cosine(new double[]{1}, new double[]{1, 2}));
    }

    @Test
    void testJaccardOverNormalizedTokens() {
        assertEquals(1.0, SimilarityScorer.jaccard("Blue sky", "sky, BLUE!"), 1e-9);
        assertEquals(0.5, SimilarityScorer.jaccard("a b c", "b c d"), 1e-9);
        assertEquals(1.0, SimilarityScorer.jaccard("", "  "), 1e-9);
        assertEquals(0.0, SimilarityScorer.jaccard("alpha", ""), 1e-9);
    }

    @Test
    void testNormalize() {
        assertEquals("hello world 42", SimilarityScorer.normalize("  Hello,   World! 42. "));
        assertEquals("", SimilarityScorer.normalize(null));
        assertEquals(Set.of("a", "b"), SimilarityScorer.tokens("A; b a"));
    }

    @Test
    void testScorePrefersEmbeddings() {
        AgentAnswer first = new AgentAnswer("t", "a1", null, "yes", null, new double[]{1, 0}, 1.0, Instant.now());
        AgentAnswer second = new AgentAnswer("t", "a2", null, "no", null, new double[]{1, 0}, 1.0, Instant.now());
        AgentAnswer plain = AgentAnswer.text("t", "a3", "yes");

        assertEquals(1.0, SimilarityScorer.score(first, second), 1e-9);
        assertEquals(1.0, SimilarityScorer.score(first, plain), 1e-9);
    }
}
