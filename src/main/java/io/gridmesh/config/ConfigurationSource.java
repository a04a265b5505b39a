package io.gridmesh.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

public interface ConfigurationSource {

    Optional<JsonNode> node(String path);

    default Optional<String> getString(String path) {
        return node(path)
                .filter(n -> n.isValueNode() && !n.isNull())
                .map(JsonNode::asText)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    default String getString(String path, String fallback) {
        return getString(path).orElse(fallback);
    }

    default String require(String path) {
        return getString(path).orElseThrow(() -> new ConfigurationException(path, "missing required configuration key"));
    }

    // Lists are JSON arrays or comma-separated strings.
    default List<String> getList(String path) {
        Optional<JsonNode> found = node(path);
        if (found.isEmpty()) {
            return List.of();
        }
        JsonNode value = found.get();
        List<String> out = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode item : value) {
                String text = item.asText("").trim();
                if (!text.isEmpty()) {
                    out.add(text);
                }
            }
            return out;
        }
        if (value.isValueNode()) {
            for (String part : value.asText("").split(",")) {
                String text = part.trim();
                if (!text.isEmpty()) {
                    out.add(text);
                }
            }
        }
        return out;
    }

    default long getLong(String path, long fallback) {
        Optional<String> raw = getString(path);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.get());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(path, "expected an integer value", e);
        }
    }

    default double getDouble(String path, double fallback) {
        Optional<String> raw = getString(path);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.get());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(path, "expected a numeric value", e);
        }
    }

    default List<String> children(String path) {
        Optional<JsonNode> found = node(path);
        if (found.isEmpty() || !found.get().isObject()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        Iterator<String> it = found.get().fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    static Optional<JsonNode> resolve(JsonNode root, String path) {
        if (root == null) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            current = current.get(segment);
            if (current == null || current.isMissingNode()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
