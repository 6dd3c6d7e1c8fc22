package com.perpconnector.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe field readers for exchange JSON. Exchange numbers arrive as either JSON numbers
 * or decimal strings; anything missing, null or unparsable reads as null.
 */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    static BigDecimal decimal(JsonNode node, String field) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Epoch-millisecond field as an Instant, or null. */
    static Instant millis(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        return value != null ? Instant.ofEpochMilli(value.longValue()) : null;
    }

    /** An array's elements, a single object as a one-element list, or nothing. */
    static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return result;
        }
        if (node.isArray()) {
            node.forEach(result::add);
        } else if (node.isObject()) {
            result.add(node);
        }
        return result;
    }
}
