package com.legisgraph.citegraph.service.lineage;

import com.legisgraph.citegraph.model.GraphStats;
import com.legisgraph.citegraph.model.LawLink;
import com.legisgraph.citegraph.model.SectionLineage;

import java.util.List;
import java.util.Optional;

public interface GraphQueryService {

    Optional<LawLink> enactingLaw(String sectionId);

    /**
     * Amending laws of a section ordered by enacted date; undated laws come last.
     */
    List<LawLink> amendments(String sectionId);

    /**
     * @throws SectionNotFoundException when the graph holds no such section
     */
    SectionLineage lineage(String sectionId);

    GraphStats stats();
}
