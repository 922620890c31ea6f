package org.companyllm.rag.connectors.text;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Helpers for reading optional payload fields into flat string metadata.
 */
public class Metadata {
    private Metadata() {}

    /** Text at {@code node}, or {@code fallback} when the node is missing, null or blank. */
    public static String text(JsonNode node, String fallback) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return fallback;
        }
        var value = node.asText();
        return value.isBlank() ? fallback : value;
    }

    public static void putIfPresent(Map<String, String> metadata, String key, JsonNode node) {
        var value = text(node, null);
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
