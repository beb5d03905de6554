package br.com.pvss.webhookreceiver.service;

import br.com.pvss.webhookreceiver.model.InboundPayload;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class CorrelationKeyDeriver {

    private final List<String> fieldPaths;
    private final String fallbackKey;

    public CorrelationKeyDeriver(List<String> fieldPaths, String fallbackKey) {
        if (fallbackKey == null || fallbackKey.isEmpty()) {
            throw new IllegalArgumentException("fallbackKey não pode ser vazio");
        }
        this.fieldPaths = List.copyOf(fieldPaths);
        this.fallbackKey = fallbackKey;
    }

    public String derive(JsonNode payload) {
        JsonNode body = InboundPayload.normalize(payload);
        for (String path : fieldPaths) {
            String candidate = usable(lookup(body, path));
            if (candidate != null) {
                return candidate;
            }
        }
        return fallbackKey;
    }

    private static JsonNode lookup(JsonNode body, String path) {
        JsonNode current = body;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    private static String usable(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            String text = node.textValue();
            return text.isEmpty() ? null : text;
        }
        if (node.isNumber()) {
            return node.asText();
        }
        return null;
    }
}
