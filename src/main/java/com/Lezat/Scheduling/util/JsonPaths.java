package com.Lezat.Scheduling.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookups over loosely shaped provider JSON. Paths are dot separated, e.g. {@code meeting.join_url}.
 */
public final class JsonPaths {

    private static final String[] TEXT_KEYS = {"text", "content", "transcript", "value"};

    private JsonPaths() {
    }

    public static JsonNode at(JsonNode root, String path) {
        JsonNode node = root;
        for (String part : path.split("\\.")) {
            if (node == null || !node.isObject()) return null;
            node = node.get(part);
        }
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    /** First path holding a non-blank scalar, as trimmed text. Numbers count as text. */
    public static String firstText(JsonNode root, String... paths) {
        for (String path : paths) {
            JsonNode node = at(root, path);
            if (node != null && node.isValueNode()) {
                String value = node.asText("").trim();
                if (!value.isEmpty()) return value;
            }
        }
        return null;
    }

    public static JsonNode firstPresent(JsonNode root, String... paths) {
        for (String path : paths) {
            JsonNode node = at(root, path);
            if (node != null) return node;
        }
        return null;
    }

    /** First path that flattens to non-blank text via {@link #toText(JsonNode)}. */
    public static String firstFlattenedText(JsonNode root, String... paths) {
        for (String path : paths) {
            String text = toText(at(root, path));
            if (text != null) return text;
        }
        return null;
    }

    /**
     * Flattens a node into text: strings are trimmed, arrays are joined line by line and objects
     * contribute their first text-like field.
     */
    public static String toText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) {
            String s = node.asText().trim();
            return s.isEmpty() ? null : s;
        }
        if (node.isArray()) {
            List<String> lines = new ArrayList<>();
            for (JsonNode item : node) {
                String line = toText(item);
                if (line != null) lines.add(line);
            }
            return lines.isEmpty() ? null : String.join("\n", lines);
        }
        if (node.isObject()) {
            for (String key : TEXT_KEYS) {
                String s = toText(node.get(key));
                if (s != null) return s;
            }
        }
        return null;
    }

    public static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
