package com.metadata.reconciliation.rules;

import com.metadata.reconciliation.core.model.MetadataField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Produces the comparison form of a text value.
 * The input is first decomposed (Unicode NFKD) so that accents become separate
 * combining marks, then the field's rules run in order, then
 * the result is lower-cased, trimmed and whitespace-collapsed.
 *
 * <p>Engines are immutable and can be shared across threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Comparator<NormalizationRule> BY_ORDER = Comparator.comparingInt(NormalizationRule::order);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_ORDER);
        this.rules = List.copyOf(sorted);
    }

    /**
     * Returns a new engine with {@code extra} added to this engine's rules.
     */
    public NormalizationEngine withRules(List<NormalizationRule> extra) {
        List<NormalizationRule> combined = new ArrayList<>(rules);
        combined.addAll(extra);
        return new NormalizationEngine(combined);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes free text, such as a search string, using every rule.
     */
    public String normalize(String value) {
        return normalize(value, null);
    }

    /**
     * Normalizes a value using the rules scoped to the given field.
     * Null and blank input normalize to the empty string.
     */
    public String normalize(String value, MetadataField field) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(value, Normalizer.Form.NFKD);

        for (NormalizationRule rule : rules) {
            if (field == null || rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("normalization.rule rule={} field={} before='{}' after='{}'",
                            rule.name(), field, before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two values are equal after normalization.
     */
    public boolean areEquivalent(String value1, String value2, MetadataField field) {
        return normalize(value1, field).equals(normalize(value2, field));
    }
}
