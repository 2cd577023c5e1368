package com.example.quorum.consensus;

import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Maps answers to comparison signatures and decides whether two answers belong together.
 *
 * <p>Structured answers match only on identical canonical JSON. Free-text answers match when their
 * normalized text is identical or their similarity reaches the configured threshold.
 */
public class AnswerCanonicalizer {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private static final int DIGEST_HEX_LENGTH = 16;

    private final double similarityThreshold;

    public AnswerCanonicalizer() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    public AnswerCanonicalizer(double similarityThreshold) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1]: " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Signature of an answer: {@code json:<digest>} for structured payloads,
     * {@code text:<digest>} of the normalized text otherwise.
     */
    public String signatureOf(AgentAnswer answer) {
        if (answer.isStructured()) {
            return "json:" + digest(JsonCodec.canonicalize(answer.getStructuredContent()));
        }
        return "text:" + digest(SimilarityScorer.normalize(answer.asText()));
    }

    /**
     * Whether a candidate answer joins the bucket represented by {@code representative}.
     */
    public boolean matches(AgentAnswer representative, String representativeSignature,
                           AgentAnswer candidate, String candidateSignature) {
        if (representative.isStructured() != candidate.isStructured()) {
            return false;
        }
        if (representativeSignature.equals(candidateSignature)) {
            return true;
        }
        if (candidate.isStructured()) {
            return false;
        }
        return SimilarityScorer.score(representative, candidate) >= similarityThreshold;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    static String digest(String value) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.substring(0, DIGEST_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
