package com.legisgraph.citegraph.service.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record GraphNode(NodeLabel label, String id, Map<String, Object> properties) {

    public GraphNode {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(id, "id");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public boolean hasProperty(String key) {
        return properties.get(key) != null;
    }

    /**
     * Values in {@code updates} replace existing ones; keys absent from {@code updates} are kept.
     */
    public GraphNode mergedWith(Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(properties);
        if (updates != null) {
            updates.forEach((key, value) -> {
                if (key != null && value != null) {
                    merged.put(key, value);
                }
            });
        }
        merged.put("id", id);
        return new GraphNode(label, id, merged);
    }
}
