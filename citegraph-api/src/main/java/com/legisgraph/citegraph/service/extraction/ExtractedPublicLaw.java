package com.legisgraph.citegraph.service.extraction;

import com.legisgraph.citegraph.service.citation.PublicLawCitation;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * A Public Law as observed in one or more sections' source credits.
 * <p>
 * {@code positionInSource} maps a section id to the zero-based order in which the law is
 * cited in that section's source credit; position {@code 0} marks the enacting law.
 */
public record ExtractedPublicLaw(int congress,
                                 int lawNumber,
                                 LocalDate enactedDate,
                                 String statutesAtLarge,
                                 Set<String> sourceSectionIds,
                                 Map<String, Integer> positionInSource) {

    public ExtractedPublicLaw {
        sourceSectionIds = sourceSectionIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sourceSectionIds));
        positionInSource = positionInSource == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(positionInSource));
    }

    public static ExtractedPublicLaw observed(int congress,
                                              int lawNumber,
                                              LocalDate enactedDate,
                                              String statutesAtLarge,
                                              String sectionId,
                                              int position) {
        Objects.requireNonNull(sectionId, "sectionId");
        return new ExtractedPublicLaw(congress, lawNumber, enactedDate, statutesAtLarge,
                Set.of(sectionId), Map.of(sectionId, position));
    }

    public String canonicalId() {
        return PublicLawCitation.canonicalOf(congress, lawNumber);
    }

    public OptionalInt positionIn(String sectionId) {
        Integer position = positionInSource.get(sectionId);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /**
     * Folds a later observation of the same law into this one. Section ids and positions are
     * unioned; date and Stat citation keep the value already present and only fill gaps.
     * When one section cites the law more than once, its earliest position is kept.
     */
    public ExtractedPublicLaw absorb(ExtractedPublicLaw other) {
        if (!canonicalId().equals(other.canonicalId())) {
            throw new IllegalArgumentException("Cannot merge " + other.canonicalId() + " into " + canonicalId());
        }
        Set<String> sections = new LinkedHashSet<>(sourceSectionIds);
        sections.addAll(other.sourceSectionIds);
        Map<String, Integer> positions = new LinkedHashMap<>(positionInSource);
        other.positionInSource.forEach((section, position) -> positions.merge(section, position, Integer::min));
        return new ExtractedPublicLaw(
                congress,
                lawNumber,
                enactedDate != null ? enactedDate : other.enactedDate,
                statutesAtLarge != null ? statutesAtLarge : other.statutesAtLarge,
                sections,
                positions);
    }
}
