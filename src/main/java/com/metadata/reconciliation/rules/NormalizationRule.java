package com.metadata.reconciliation.rules;

import com.metadata.reconciliation.core.model.MetadataField;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite run on a text field's value before comparison.
 *
 * @param name        identifies the rule in trace logs
 * @param pattern     case-insensitive pattern to replace
 * @param replacement replacement text, may use group references
 * @param fields      the text fields the rule rewrites
 * @param order       position in the rule chain, lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement,
                                Set<MetadataField> fields, int order) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + name + "' must name at least one field");
        }
        for (MetadataField field : fields) {
            if (field.getValueType() != String.class) {
                throw new IllegalArgumentException("Rule '" + name + "' cannot rewrite numeric field " + field);
            }
        }
        fields = Set.copyOf(EnumSet.copyOf(fields));
    }

    /**
     * Compiles {@code regex} case-insensitively and scopes the rule to {@code fields}.
     */
    public static NormalizationRule of(String name, String regex, String replacement, int order,
                                       MetadataField... fields) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new NormalizationRule(name, pattern, replacement, Set.copyOf(Arrays.asList(fields)), order);
    }

    public boolean appliesTo(MetadataField field) {
        return fields.contains(field);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
