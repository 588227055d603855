package com.metadata.reconciliation.scoring;

import com.metadata.reconciliation.core.model.SourceRecord;

import java.util.Objects;

/**
 * Combines a record's confidence and completeness into one ranking value.
 * Formula: score = wConfidence * confidence + wCompleteness * completeness, clamped to [0,1].
 */
public class RecordScorer {

    private final ScoringWeights weights;

    public RecordScorer() {
        this(ScoringWeights.defaultWeights());
    }

    public RecordScorer(ScoringWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public double score(SourceRecord record) {
        return score(record.getConfidence(), record.getCompleteness());
    }

    public double score(double confidence, double completeness) {
        double raw = weights.confidenceWeight() * confidence
                + weights.completenessWeight() * completeness;
        return clamp(raw);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    static double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
