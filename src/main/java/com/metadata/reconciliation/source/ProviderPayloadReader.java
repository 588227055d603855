package com.metadata.reconciliation.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metadata.reconciliation.core.model.ProviderPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads provider payloads from the JSON emitted by provider clients.
 *
 * <p>Accepted layouts: a single object, a JSON array of objects, or JSON Lines
 * (one object per line). The provider tag is read from the {@code provider}
 * key; every other key becomes an attribute.</p>
 * <pre>
 * {"provider": "musicbrainz", "title": "Bohemian Rhapsody", "artist": "Queen", "score": 95}
 * {"provider": "youtube", "title": "Queen - Bohemian Rhapsody (Official Video)", "channel": "Queen Official"}
 * </pre>
 *
 * <p>A missing or non-text provider tag is not a parse error: the payload is
 * returned with a null tag and rejected later by the normalizer.</p>
 */
public class ProviderPayloadReader {
    private static final Logger log = LoggerFactory.getLogger(ProviderPayloadReader.class);

    public static final String PROVIDER_KEY = "provider";

    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProviderPayloadReader() {
        this(new ObjectMapper());
    }

    public ProviderPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ProviderPayload> read(String json) {
        return read(new StringReader(json));
    }

    public List<ProviderPayload> read(InputStream input) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * Reads every payload from the reader, closing it when done.
     *
     * @throws PayloadParseException if the input is not valid JSON or holds a non-object payload
     */
    public List<ProviderPayload> read(Reader reader) {
        List<ProviderPayload> payloads = new ArrayList<>();
        try (MappingIterator<JsonNode> values = objectMapper.readerFor(JsonNode.class).readValues(reader)) {
            while (values.hasNextValue()) {
                JsonNode root = values.nextValue();
                if (root.isArray()) {
                    for (JsonNode element : root) {
                        payloads.add(toPayload(element));
                    }
                } else {
                    payloads.add(toPayload(root));
                }
            }
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Malformed payload JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PayloadParseException("Could not read payload JSON: " + e.getMessage(), e);
        }
        log.debug("payload.read count={}", payloads.size());
        return payloads;
    }

    /**
     * Converts one JSON object into a payload.
     */
    public ProviderPayload toPayload(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PayloadParseException("Expected a JSON object per payload but got "
                    + (node == null ? "nothing" : node.getNodeType()));
        }
        ObjectNode attributesNode = ((ObjectNode) node).deepCopy();
        JsonNode tagNode = attributesNode.remove(PROVIDER_KEY);
        String tag = tagNode != null && tagNode.isTextual() ? tagNode.asText() : null;
        Map<String, Object> attributes = objectMapper.convertValue(attributesNode, ATTRIBUTES_TYPE);
        return new ProviderPayload(tag, attributes);
    }
}
