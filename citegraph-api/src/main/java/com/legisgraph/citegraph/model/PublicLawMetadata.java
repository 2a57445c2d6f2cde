package com.legisgraph.citegraph.model;

import com.legisgraph.citegraph.service.citation.PublicLawCitation;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

/**
 * Descriptive data for a Public Law as published by Congress.gov.
 */
public record PublicLawMetadata(@Positive int congress,
                                @Positive int lawNumber,
                                String title,
                                LocalDate enactedDate,
                                String statutesAtLargeCitation) {

    public String canonicalId() {
        return PublicLawCitation.canonicalOf(congress, lawNumber);
    }
}
