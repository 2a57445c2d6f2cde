package com.legisgraph.citegraph.model;

import java.util.List;

/**
 * A section with the law that enacted it and the laws that amended it, oldest amendment first.
 * {@code enactedBy} is null when the section's source credit named no law.
 */
public record SectionLineage(String sectionId, String sectionName, LawLink enactedBy, List<LawLink> amendments) {

    public SectionLineage {
        amendments = amendments == null ? List.of() : List.copyOf(amendments);
    }

    public int amendmentCount() {
        return amendments.size();
    }
}
