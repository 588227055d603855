package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.model.Candidate;
import com.metadata.reconciliation.core.model.FieldResolution;
import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SelectionMode;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.corroboration.CorroborationDetector;
import com.metadata.reconciliation.corroboration.FieldCorroboration;
import com.metadata.reconciliation.scoring.RecordScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges scored source records into one {@link MergedMetadata}.
 *
 * <p>Each field is decided independently:</p>
 * <ol>
 *   <li>Every record with a value for the field contributes a candidate scored
 *       with the record's overall score.</li>
 *   <li>Candidates that agree with another provider receive the corroboration bonus.</li>
 *   <li>The highest effective score wins; ties go to the higher-priority provider.</li>
 * </ol>
 *
 * <p>The selected value is always the winner's literal value. Input order does
 * not affect the result.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final RecordScorer scorer;
    private final CorroborationDetector corroborationDetector;

    public MergeEngine() {
        this(new RecordScorer(), new CorroborationDetector());
    }

    public MergeEngine(RecordScorer scorer, CorroborationDetector corroborationDetector) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.corroborationDetector = Objects.requireNonNull(corroborationDetector, "corroborationDetector is required");
    }

    /**
     * Merges the records, at most one per provider.
     *
     * @throws NoMetadataAvailableException if there are no records
     * @throws IllegalArgumentException if two records come from the same provider
     */
    public MergedMetadata merge(Collection<SourceRecord> records) {
        validate(records);

        Map<MetadataField, FieldResolution> resolutions = new EnumMap<>(MetadataField.class);
        for (MetadataField field : MetadataField.values()) {
            resolutions.put(field, resolve(field, records));
        }
        MergedMetadata merged = MergedMetadata.of(resolutions);

        log.debug("merge.completed records={} mergeConfidence={}", records.size(), merged.getMergeConfidence());
        return merged;
    }

    /**
     * Decides a single field automatically.
     */
    public FieldResolution resolve(MetadataField field, Collection<SourceRecord> records) {
        List<Candidate> candidates = candidates(field, records);
        if (candidates.isEmpty()) {
            return FieldResolution.empty(field);
        }
        Candidate winner = candidates.get(0);
        return new FieldResolution(field, winner.value(), winner.provider(), candidates,
                isCorroborated(candidates), SelectionMode.AUTOMATIC);
    }

    /**
     * Builds the ranked candidate pool for a field, best first.
     */
    public List<Candidate> candidates(MetadataField field, Collection<SourceRecord> records) {
        FieldCorroboration corroboration = corroborationDetector.detect(field, records);
        List<Candidate> candidates = new ArrayList<>();
        for (SourceRecord record : records) {
            if (!record.hasValue(field)) {
                continue;
            }
            Provider provider = record.getProvider();
            double effective = corroboration.effectiveScore(provider, scorer.score(record));
            candidates.add(new Candidate(provider, record.getValue(field), effective,
                    corroboration.isAgreeing(provider)));
        }
        candidates.sort(Candidate.RANKING);
        return candidates;
    }

    static boolean isCorroborated(List<Candidate> candidates) {
        return candidates.stream().anyMatch(Candidate::agreeing);
    }

    static void validate(Collection<SourceRecord> records) {
        Objects.requireNonNull(records, "records is required");
        if (records.isEmpty()) {
            throw new NoMetadataAvailableException();
        }
        Set<Provider> seen = EnumSet.noneOf(Provider.class);
        for (SourceRecord record : records) {
            Objects.requireNonNull(record, "records must not contain null");
            if (!seen.add(record.getProvider())) {
                throw new IllegalArgumentException("More than one record from provider " + record.getProvider());
            }
        }
    }

    public RecordScorer getScorer() {
        return scorer;
    }

    public CorroborationDetector getCorroborationDetector() {
        return corroborationDetector;
    }
}
