package com.metadata.reconciliation.scoring;

/**
 * Relative weight of confidence and completeness in a record's overall score.
 * Confidence dominates by default: a sparse but correct match beats a rich but wrong one.
 */
public record ScoringWeights(double confidenceWeight, double completenessWeight) {

    public ScoringWeights {
        if (confidenceWeight < 0 || completenessWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = confidenceWeight + completenessWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.7 confidence, 0.3 completeness.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.7, 0.3);
    }
}
