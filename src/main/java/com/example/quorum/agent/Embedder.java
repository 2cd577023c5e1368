package com.example.quorum.agent;

/**
 * Produces embedding vectors used to compare free-text answers.
 */
@FunctionalInterface
public interface Embedder {

    double[] embed(String text);
}
