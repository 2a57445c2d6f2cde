package com.legisgraph.citegraph.service.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.legisgraph.citegraph.model.SectionRecord;
import com.legisgraph.citegraph.service.citation.Subsections;

import java.time.OffsetDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UscSectionNode(String id,
                             Citation citation,
                             String sectionName,
                             String titleName,
                             String chapter,
                             String sourceCredit,
                             String text,
                             String sourceName,
                             OffsetDateTime retrievedAt) {

    public static UscSectionNode from(SectionRecord record, Provenance provenance) {
        return new UscSectionNode(
                record.sectionId(),
                new Citation(record.title(), record.section(), Subsections.normalize(record.subsection())),
                record.sectionName(),
                record.titleName(),
                record.chapter(),
                record.sourceCredit(),
                record.text(),
                provenance.sourceName(),
                provenance.retrievedAt());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Citation(int title, String section, String subsection) {
    }
}
