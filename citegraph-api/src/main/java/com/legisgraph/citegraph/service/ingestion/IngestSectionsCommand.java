package com.legisgraph.citegraph.service.ingestion;

import com.legisgraph.citegraph.model.SectionRecord;

import java.util.List;

public record IngestSectionsCommand(List<SectionRecord> sections, boolean dryRun) {
}
