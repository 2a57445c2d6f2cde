package com.legisgraph.citegraph.model;

import java.util.Map;

public record GraphStats(Map<String, Long> nodesByLabel, Map<String, Long> edgesByType) {

    public long totalNodes() {
        return nodesByLabel.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalEdges() {
        return edgesByType.values().stream().mapToLong(Long::longValue).sum();
    }
}
