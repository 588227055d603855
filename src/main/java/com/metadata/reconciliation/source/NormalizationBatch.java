package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.model.SourceRecord;

import java.util.List;

/**
 * Outcome of normalizing every payload gathered for one query.
 *
 * @param records  the usable source records, at most one per provider
 * @param rejected payloads that were dropped, with the reason
 */
public record NormalizationBatch(List<SourceRecord> records, List<RejectedPayload> rejected) {

    public NormalizationBatch {
        records = records != null ? List.copyOf(records) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * A payload dropped during normalization.
     *
     * @param index       position of the payload in the input collection
     * @param providerTag the tag it carried, possibly null
     * @param reason      why it was dropped
     */
    public record RejectedPayload(int index, String providerTag, String reason) {
    }
}
