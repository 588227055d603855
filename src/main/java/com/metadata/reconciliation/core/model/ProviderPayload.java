package com.metadata.reconciliation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Raw result from one provider client, before normalization.
 * The provider tag may be missing or unknown; the normalizer rejects such payloads.
 *
 * @param providerTag tag naming the provider, e.g. "musicbrainz"
 * @param attributes  provider attributes keyed by the provider's own names
 */
public record ProviderPayload(String providerTag, Map<String, Object> attributes) {

    public ProviderPayload {
        // values may be null
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public static ProviderPayload of(Provider provider, Map<String, Object> attributes) {
        return new ProviderPayload(provider.name().toLowerCase(Locale.ROOT), attributes);
    }

    public Optional<Provider> provider() {
        return Provider.fromTag(providerTag);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
