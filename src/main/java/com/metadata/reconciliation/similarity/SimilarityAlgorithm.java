package com.metadata.reconciliation.similarity;

/**
 * Scores how closely a free-form provider string (such as a video title)
 * resembles the query. Scores range from 0.0 (unrelated) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity of two already-normalized strings.
     */
    double compute(String s1, String s2);

    /**
     * Computes the similarity, never returning more than {@code cap}.
     */
    default double computeCapped(String s1, String s2, double cap) {
        return Math.min(cap, compute(s1, s2));
    }

    String getName();
}
