package com.metadata.reconciliation.api;

import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.source.NormalizationBatch;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of reconciling one query: the merge, the records it was built
 * from (needed for later overrides) and the payloads that were dropped.
 */
public record ReconciliationResult(
        String correlationId,
        MergedMetadata merged,
        List<SourceRecord> records,
        List<NormalizationBatch.RejectedPayload> rejected
) {
    public ReconciliationResult {
        Objects.requireNonNull(merged, "merged is required");
        records = records != null ? List.copyOf(records) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}
