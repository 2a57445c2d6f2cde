package com.legisgraph.citegraph.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record IngestSectionsRequest(@NotEmpty List<@Valid SectionRecord> sections, boolean dryRun) {
}
