package com.legisgraph.citegraph.service.ingestion;

import com.legisgraph.citegraph.model.IngestionReport;
import com.legisgraph.citegraph.model.PublicLawMetadata;

import java.util.List;

public interface IngestionService {

    IngestionReport ingestSections(IngestSectionsCommand command);

    /**
     * @return the number of Public Law nodes that gained at least one field
     */
    int enrichPublicLaws(List<PublicLawMetadata> metadata);
}
