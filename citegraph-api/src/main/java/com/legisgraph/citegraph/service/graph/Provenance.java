package com.legisgraph.citegraph.service.graph;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Where a node's data came from and when it was read.
 */
public record Provenance(String sourceName, OffsetDateTime retrievedAt) {

    public Provenance {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(retrievedAt, "retrievedAt");
    }
}
