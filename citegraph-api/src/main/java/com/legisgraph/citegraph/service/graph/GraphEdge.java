package com.legisgraph.citegraph.service.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed edge. Identity is the {@code (fromId, toId, type)} triple.
 */
public record GraphEdge(String fromId, String toId, RelationshipType type, Map<String, Object> properties) {

    public GraphEdge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(type, "type");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Key key() {
        return new Key(fromId, toId, type);
    }

    public record Key(String fromId, String toId, RelationshipType type) {
    }
}
