package com.llmbridge.frontend;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmbridge.errors.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class WireFields {

    private WireFields() {}

    static Double optDouble(JsonNode body, String field) {
        var n = body.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.isNumber()) throw new ValidationException(field, "must be a number");
        return n.asDouble();
    }

    static Integer optInt(JsonNode body, String field) {
        var n = body.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.canConvertToInt() || !n.isIntegralNumber()) throw new ValidationException(field, "must be an integer");
        return n.asInt();
    }

    static String optText(JsonNode body, String field) {
        var n = body.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.isTextual()) throw new ValidationException(field, "must be a string");
        return n.asText();
    }

    static List<String> stringOrArray(JsonNode body, String field) {
        var n = body.get(field);
        var out = new ArrayList<String>();
        if (n == null || n.isNull()) return out;
        if (n.isTextual()) {
            out.add(n.asText());
        } else if (n.isArray()) {
            n.forEach(e -> out.add(e.asText()));
        } else {
            throw new ValidationException(field, "must be a string or an array of strings");
        }
        return out;
    }

    static JsonNode requireArray(JsonNode body, String field) {
        var n = body.get(field);
        if (n == null || !n.isArray()) throw new ValidationException(field, "must be an array");
        return n;
    }

    static Map<String, String> stringMap(JsonNode node) {
        var out = new LinkedHashMap<String, String>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        }
        return out;
    }
}
