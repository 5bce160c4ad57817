package com.aegis.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared Jackson configuration and canonical serialization.
 * <p>
 * Canonical form: object keys sorted recursively, timestamps as ISO-8601
 * strings, nulls omitted by the model classes. Two structurally equal values
 * always produce the same canonical bytes regardless of insertion order.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = createMapper();

    private CanonicalJson() {
    }

    /**
     * The process-wide mapper. Thread-safe once configured; callers must not
     * reconfigure it.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Converts any model value to a JSON tree.
     */
    public static JsonNode toTree(Object value) {
        if (value instanceof JsonNode node) {
            return node;
        }
        return MAPPER.valueToTree(value);
    }

    /**
     * Returns a copy of the tree with every object's fields in lexicographic order.
     */
    public static JsonNode sorted(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, sorted(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                array.add(sorted(element));
            }
            return array;
        }
        return node;
    }

    /**
     * Canonical string form of a value.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String canonicalString(Object value) {
        try {
            return MAPPER.writeValueAsString(sorted(toTree(value)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getMessage(), e);
        }
    }

    public static byte[] canonicalBytes(Object value) {
        return canonicalString(value).getBytes(StandardCharsets.UTF_8);
    }
}
