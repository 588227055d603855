package com.metadata.reconciliation.rules;

import com.metadata.reconciliation.core.model.MetadataField;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for comparing track metadata text across providers.
 * Together with the engine's decomposition and case folding they make
 * "Beyoncé &amp; Jay‐Z" and "beyonce and jay-z" equivalent.
 *
 * <p>The rules rewrite display text only. Cover art URLs are compared after
 * case folding alone, since an ampersand or apostrophe there is part of the
 * address.</p>
 */
public final class DefaultNormalizationRules {

    private static final MetadataField[] DISPLAY_TEXT = {
            MetadataField.TITLE, MetadataField.ARTIST, MetadataField.ALBUM, MetadataField.GENRE
    };

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>(getUnicodeRules());
        rules.addAll(getPunctuationRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Rules that undo typographic variation introduced by different providers.
     */
    public static List<NormalizationRule> getUnicodeRules() {
        return List.of(
                // Combining marks left behind by NFKD decomposition (é -> e + U+0301)
                NormalizationRule.of("strip-diacritics", "\\p{M}+", "", 10, DISPLAY_TEXT),
                NormalizationRule.of("unify-apostrophes",
                        "[\\u2018\\u2019\\u201A\\u201B\\u2032\\u2035\\u02BB\\u02BC\\u02BD\\u02BE\\u02BF\\u02CA\\u02CB`]",
                        "'", 20, DISPLAY_TEXT),
                NormalizationRule.of("unify-double-quotes", "[\\u201C\\u201D\\u201E\\u201F\\u2033]", "\"", 20,
                        DISPLAY_TEXT),
                // Hyphen, en dash, em dash and minus sign variants
                NormalizationRule.of("unify-dashes", "[\\u2010-\\u2015\\u2212]", "-", 20, DISPLAY_TEXT)
        );
    }

    /**
     * Artist credits and titles spell "and" both ways.
     */
    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                NormalizationRule.of("ampersand-to-and", "\\s*&\\s*", " and ", 50, DISPLAY_TEXT)
        );
    }
}
