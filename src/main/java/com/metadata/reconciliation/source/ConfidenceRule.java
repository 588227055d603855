package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.core.model.TrackQuery;

/**
 * Computes how likely a provider's record is a correct match for the query.
 */
@FunctionalInterface
public interface ConfidenceRule {

    /**
     * @param payload the raw payload, for provider-reported scores
     * @param record  the extracted record values (its own confidence is not yet meaningful)
     * @param query   the user's query
     * @return confidence in [0,1]
     */
    double confidence(ProviderPayload payload, SourceRecord record, TrackQuery query);

    static ConfidenceRule fixed(double confidence) {
        return (payload, record, query) -> confidence;
    }
}
