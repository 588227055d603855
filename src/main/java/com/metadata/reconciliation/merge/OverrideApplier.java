package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.model.Candidate;
import com.metadata.reconciliation.core.model.FieldPin;
import com.metadata.reconciliation.core.model.FieldResolution;
import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SelectionMode;
import com.metadata.reconciliation.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pins fields to a caller-chosen provider on top of an existing merge.
 *
 * <p>A pinned field takes the provider's literal value; its alternates and
 * corroboration flag are recomputed from the same candidate pool the merge
 * engine uses. Unpinned fields keep their prior resolution. Applying the same
 * pins twice yields the same result.</p>
 */
public class OverrideApplier {
    private static final Logger log = LoggerFactory.getLogger(OverrideApplier.class);

    private final MergeEngine mergeEngine;

    public OverrideApplier() {
        this(new MergeEngine());
    }

    public OverrideApplier(MergeEngine mergeEngine) {
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
    }

    /**
     * Applies the pins to the prior merge.
     *
     * @param prior   the merge to start from
     * @param records the records the prior merge was built from
     * @param pins    field pins; at most one provider per field
     * @throws IllegalArgumentException if two pins name different providers for one field
     */
    public OverrideResult apply(MergedMetadata prior, Collection<SourceRecord> records, Collection<FieldPin> pins) {
        Objects.requireNonNull(prior, "prior is required");
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(pins, "pins is required");

        Map<MetadataField, Provider> pinned = collectPins(pins);
        MergedMetadata result = prior;
        List<RejectedOverride> rejected = new ArrayList<>();

        for (Map.Entry<MetadataField, Provider> pin : pinned.entrySet()) {
            MetadataField field = pin.getKey();
            Provider provider = pin.getValue();
            List<Candidate> candidates = mergeEngine.candidates(field, records);
            Optional<Candidate> chosen = candidates.stream()
                    .filter(c -> c.provider() == provider)
                    .findFirst();

            if (chosen.isEmpty()) {
                String reason = provider.getDisplayName() + " has no value for " + field.getKey();
                log.warn("override.rejected field={} provider={} reason={}", field, provider, reason);
                rejected.add(new RejectedOverride(FieldPin.of(field, provider), reason));
                continue;
            }

            Candidate candidate = chosen.get();
            result = result.withField(new FieldResolution(field, candidate.value(), provider, candidates,
                    MergeEngine.isCorroborated(candidates), SelectionMode.OVERRIDE));
            log.debug("override.applied field={} provider={}", field, provider);
        }

        return new OverrideResult(result, rejected);
    }

    private static Map<MetadataField, Provider> collectPins(Collection<FieldPin> pins) {
        Map<MetadataField, Provider> pinned = new EnumMap<>(MetadataField.class);
        for (FieldPin pin : pins) {
            Objects.requireNonNull(pin, "pins must not contain null");
            Provider existing = pinned.putIfAbsent(pin.field(), pin.provider());
            if (existing != null && existing != pin.provider()) {
                throw new IllegalArgumentException("Conflicting pins for " + pin.field() + ": "
                        + existing + " and " + pin.provider());
            }
        }
        return pinned;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }
}
