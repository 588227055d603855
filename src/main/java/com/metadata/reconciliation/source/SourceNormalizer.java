package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.core.model.TrackQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw provider payloads into scored {@link SourceRecord}s.
 * Field values come from the {@link PayloadFieldExtractor}; confidence from
 * the provider's entry in {@link ConfidenceRules}. Completeness is derived by
 * the record itself.
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    private final PayloadFieldExtractor fieldExtractor;
    private final ConfidenceRules confidenceRules;

    public SourceNormalizer() {
        this(new PayloadFieldExtractor(), new ConfidenceRules());
    }

    public SourceNormalizer(PayloadFieldExtractor fieldExtractor, ConfidenceRules confidenceRules) {
        this.fieldExtractor = Objects.requireNonNull(fieldExtractor, "fieldExtractor is required");
        this.confidenceRules = Objects.requireNonNull(confidenceRules, "confidenceRules is required");
    }

    /**
     * Normalizes a single payload.
     *
     * @throws InvalidSourceRecordException if the payload has no recognizable provider tag
     */
    public SourceRecord normalize(ProviderPayload payload, TrackQuery query) {
        if (payload == null) {
            throw new InvalidSourceRecordException(null, "Payload is null");
        }
        if (payload.providerTag() == null || payload.providerTag().isBlank()) {
            throw new InvalidSourceRecordException(null, "Payload is missing its provider tag");
        }
        Provider provider = payload.provider()
                .orElseThrow(() -> new InvalidSourceRecordException(payload.providerTag(),
                        "Unknown provider tag: " + payload.providerTag()));

        SourceRecord.Builder builder = fieldExtractor.extract(provider, payload);
        SourceRecord draft = builder.build();
        double confidence = confidenceRules.confidence(provider, payload, draft, query);
        SourceRecord record = builder.confidence(confidence).build();

        log.debug("source.normalized provider={} confidence={} completeness={}",
                provider, record.getConfidence(), record.getCompleteness());
        return record;
    }

    /**
     * Normalizes every payload, dropping the ones that cannot be used.
     * A payload is dropped when its provider tag is missing or unknown, or when
     * an earlier payload in the collection already came from the same provider.
     */
    public NormalizationBatch normalizeAll(Collection<ProviderPayload> payloads, TrackQuery query) {
        Objects.requireNonNull(payloads, "payloads is required");
        List<SourceRecord> records = new ArrayList<>();
        List<NormalizationBatch.RejectedPayload> rejected = new ArrayList<>();
        Set<Provider> seen = EnumSet.noneOf(Provider.class);

        int index = 0;
        for (ProviderPayload payload : payloads) {
            try {
                SourceRecord record = normalize(payload, query);
                if (!seen.add(record.getProvider())) {
                    throw new InvalidSourceRecordException(payload.providerTag(),
                            "Duplicate payload for provider " + record.getProvider());
                }
                records.add(record);
            } catch (InvalidSourceRecordException e) {
                log.warn("source.dropped index={} providerTag={} reason={}",
                        index, e.getProviderTag(), e.getMessage());
                rejected.add(new NormalizationBatch.RejectedPayload(index, e.getProviderTag(), e.getMessage()));
            }
            index++;
        }

        return new NormalizationBatch(records, rejected);
    }

    public ConfidenceRules getConfidenceRules() {
        return confidenceRules;
    }
}
