package com.metadata.reconciliation.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-overlap similarity: |intersection| / |union| of word tokens.
 * By default tokens are runs of letters and digits, so "Queen - Bohemian
 * Rhapsody (Official Video)" yields {queen, bohemian, rhapsody, official, video}.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final String DEFAULT_SEPARATOR = "[^\\p{L}\\p{N}']+";

    private final Pattern separator;

    public JaccardSimilarity() {
        this(DEFAULT_SEPARATOR);
    }

    public JaccardSimilarity(String separatorPattern) {
        this.separator = Pattern.compile(separatorPattern);
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);

        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    Set<String> tokenize(String s) {
        Set<String> tokenSet = new LinkedHashSet<>();
        for (String token : separator.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
