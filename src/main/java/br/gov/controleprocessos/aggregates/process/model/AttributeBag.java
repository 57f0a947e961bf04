package br.gov.controleprocessos.aggregates.process.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.TreeMap;

/**
 * JSON codec for the department-scoped attribute bag stored in a TEXT column.
 * Keys are kept sorted so the stored form is stable across writes.
 */
public final class AttributeBag {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<TreeMap<String, AttributeValue>> BAG_TYPE = new TypeReference<>() {};

    private AttributeBag() {
    }

    public static Map<String, AttributeValue> read(String json) {
        if (json == null || json.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return MAPPER.readValue(json, BAG_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Attribute bag is not valid JSON", e);
        }
    }

    public static String write(Map<String, AttributeValue> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(new TreeMap<>(attributes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Attribute bag could not be serialized", e);
        }
    }
}
