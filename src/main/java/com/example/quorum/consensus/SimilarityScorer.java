package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Similarity measures for free-text answers. Scores are in [0, 1].
 */
public final class SimilarityScorer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private SimilarityScorer() {
    }

    /**
     * Cosine similarity of the two answers' embeddings when both carry one of equal length,
     * token-set Jaccard similarity of their normalized text otherwise.
     */
    public static double score(AgentAnswer a, AgentAnswer b) {
        double[] left = a.getEmbedding();
        double[] right = b.getEmbedding();
        if (left != null && right != null && left.length > 0 && left.length == right.length) {
            return cosine(left, right);
        }
        return jaccard(a.asText(), b.asText());
    }

    /**
     * Cosine similarity clamped to [0, 1]; opposite or zero vectors score 0.
     */
    public static double cosine(double[] left, double[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                "Embedding dimensions differ: " + left.length + " vs " + right.length);
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    public static double jaccard(String left, String right) {
        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        if (leftTokens.isEmpty() && rightTokens.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        Set<String> union = new HashSet<>(leftTokens);
        union.addAll(rightTokens);
        return (double) intersection.size() / union.size();
    }

    /**
     * Lower-cases, drops punctuation and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }
}
