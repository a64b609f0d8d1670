package com.geico.poc.faunasql.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.faunasql.fql.Ref;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes store responses into plain Java values: null, Boolean, Long, Double, String,
 * {@link Ref}, {@link OffsetDateTime}, {@link LocalDate}, List and Map.
 */
public final class ResultDecoder {

    private ResultDecoder() {
    }

    public static Object decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(decode(element));
            }
            return values;
        }

        if (node.size() == 1) {
            if (node.has("@ref")) {
                return decodeRef(node.get("@ref"));
            }
            if (node.has("@ts")) {
                return OffsetDateTime.parse(node.get("@ts").asText());
            }
            if (node.has("@date")) {
                return LocalDate.parse(node.get("@date").asText());
            }
            if (node.has("@obj")) {
                return decodeObject(node.get("@obj"));
            }
        }
        return decodeObject(node);
    }

    private static Map<String, Object> decodeObject(JsonNode node) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), decode(field.getValue()));
        }
        return values;
    }

    /**
     * Document refs nest their collection's ref, which nests the {@code collections} class ref.
     */
    private static Ref decodeRef(JsonNode ref) {
        String id = ref.path("id").asText();
        JsonNode parent = ref.path("collection").path("@ref");
        if (parent.isMissingNode()) {
            return new Ref(null, id);
        }
        boolean parentIsCollection = parent.has("collection");
        return parentIsCollection ? new Ref(parent.path("id").asText(), id) : new Ref(null, id);
    }
}
