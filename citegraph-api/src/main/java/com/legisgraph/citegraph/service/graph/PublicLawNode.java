package com.legisgraph.citegraph.service.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.legisgraph.citegraph.service.extraction.ExtractedPublicLaw;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Property model of a {@code PublicLaw} node, flattened by {@link PropertyFlattener} into
 * {@code citation_congress}, {@code citation_law_number}, {@code enacted_date} and so on.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublicLawNode(String id,
                            Citation citation,
                            LocalDate enactedDate,
                            String statutesAtLargeCitation,
                            String title,
                            String sourceName,
                            OffsetDateTime retrievedAt) {

    public static PublicLawNode from(ExtractedPublicLaw law, Provenance provenance) {
        return new PublicLawNode(
                law.canonicalId(),
                new Citation(law.congress(), law.lawNumber()),
                law.enactedDate(),
                law.statutesAtLarge(),
                null,
                provenance.sourceName(),
                provenance.retrievedAt());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Citation(int congress, int lawNumber) {
    }
}
