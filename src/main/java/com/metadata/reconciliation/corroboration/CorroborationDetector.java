package com.metadata.reconciliation.corroboration;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.rules.DefaultNormalizationRules;
import com.metadata.reconciliation.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Detects agreement between providers on a field's value.
 *
 * <p>Text values agree when equal after the field's normalization rules
 * have run. Years agree when they differ by at most
 * the year tolerance, which absorbs reissue and release-date ambiguity. Other
 * numeric values must be equal.</p>
 *
 * <p>Agreement is pairwise, so with a year tolerance it is not transitive:
 * 1975, 1976 and 1977 make all three agreeing even though 1975 and 1977 differ
 * by two.</p>
 */
public class CorroborationDetector {
    private static final Logger log = LoggerFactory.getLogger(CorroborationDetector.class);

    public static final double DEFAULT_BONUS = 0.1;
    public static final int DEFAULT_YEAR_TOLERANCE = 1;

    private final NormalizationEngine normalizationEngine;
    private final double bonus;
    private final int yearTolerance;

    public CorroborationDetector() {
        this(DefaultNormalizationRules.createDefaultEngine(), DEFAULT_BONUS, DEFAULT_YEAR_TOLERANCE);
    }

    public CorroborationDetector(NormalizationEngine normalizationEngine, double bonus, int yearTolerance) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        if (bonus < 0.0 || bonus > 1.0) {
            throw new IllegalArgumentException("bonus must be between 0.0 and 1.0");
        }
        if (yearTolerance < 0) {
            throw new IllegalArgumentException("yearTolerance must not be negative");
        }
        this.bonus = bonus;
        this.yearTolerance = yearTolerance;
    }

    /**
     * Compares the field across every record that has a value for it.
     */
    public FieldCorroboration detect(MetadataField field, Collection<SourceRecord> records) {
        List<SourceRecord> withValue = new ArrayList<>();
        for (SourceRecord record : records) {
            if (record.hasValue(field)) {
                withValue.add(record);
            }
        }
        if (withValue.size() < 2) {
            return FieldCorroboration.none(field);
        }

        List<Object> comparable = new ArrayList<>(withValue.size());
        for (SourceRecord record : withValue) {
            comparable.add(comparisonForm(field, record.getValue(field)));
        }

        Set<Provider> agreeing = EnumSet.noneOf(Provider.class);
        for (int i = 0; i < withValue.size(); i++) {
            for (int j = i + 1; j < withValue.size(); j++) {
                Provider a = withValue.get(i).getProvider();
                Provider b = withValue.get(j).getProvider();
                if (a != b && comparableValuesAgree(field, comparable.get(i), comparable.get(j))) {
                    agreeing.add(a);
                    agreeing.add(b);
                }
            }
        }

        if (!agreeing.isEmpty()) {
            log.debug("corroboration.detected field={} providers={}", field, agreeing);
        }
        return new FieldCorroboration(field, agreeing, bonus);
    }

    /**
     * Checks whether two literal values for a field agree.
     */
    public boolean agree(MetadataField field, Object value1, Object value2) {
        if (value1 == null || value2 == null) {
            return false;
        }
        return comparableValuesAgree(field, comparisonForm(field, value1), comparisonForm(field, value2));
    }

    private Object comparisonForm(MetadataField field, Object value) {
        if (value instanceof String text) {
            return normalizationEngine.normalize(text, field);
        }
        return value;
    }

    private boolean comparableValuesAgree(MetadataField field, Object a, Object b) {
        if (field == MetadataField.YEAR && a instanceof Integer y1 && b instanceof Integer y2) {
            return Math.abs(y1 - y2) <= yearTolerance;
        }
        if (a instanceof String s1 && s1.isEmpty()) {
            return false;
        }
        return a.equals(b);
    }

    public double getBonus() {
        return bonus;
    }

    public int getYearTolerance() {
        return yearTolerance;
    }
}
