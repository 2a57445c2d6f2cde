package com.legisgraph.citegraph.service.graph;

import java.util.Arrays;
import java.util.Optional;

public enum NodeLabel {
    USC_SECTION("USCSection"),
    PUBLIC_LAW("PublicLaw");

    private final String label;

    NodeLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<NodeLabel> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(value -> value.label.equals(label))
                .findFirst();
    }
}
