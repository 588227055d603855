package com.metadata.reconciliation.cache;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SourceRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 fingerprint of a record set, independent of record order.
 * Records are sorted by provider priority and written field by field in
 * field order before hashing.
 */
public final class RecordSetFingerprint {

    private RecordSetFingerprint() {
    }

    public static String of(Collection<SourceRecord> records) {
        List<SourceRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(SourceRecord::getProvider, Provider.BY_PRIORITY));
        return sha256(canonicalForm(sorted));
    }

    static String canonicalForm(List<SourceRecord> sorted) {
        StringBuilder sb = new StringBuilder();
        for (SourceRecord record : sorted) {
            sb.append(record.getProvider().name())
                    .append('|').append(Double.toString(record.getConfidence()));
            Map<MetadataField, Object> values = record.getValues();
            for (MetadataField field : MetadataField.values()) {
                Object value = values.get(field);
                if (value != null) {
                    String text = value.toString();
                    sb.append('|').append(field.getKey())
                            .append('=').append(text.length()).append(':').append(text);
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
