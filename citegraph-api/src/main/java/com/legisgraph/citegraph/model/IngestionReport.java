package com.legisgraph.citegraph.model;

import java.util.Map;

/**
 * Outcome of one ingestion run. In a dry run the node and edge counters report what would have
 * been written.
 *
 * @param topCongresses law counts of the busiest congresses, largest first
 */
public record IngestionReport(int sectionsProcessed,
                              int citationsExtracted,
                              int uniqueLaws,
                              int newLaws,
                              int lawsWithDate,
                              int lawsWithStatutesAtLarge,
                              int sectionNodesWritten,
                              int enactsCreated,
                              int amendsCreated,
                              int edgesSkipped,
                              Map<Integer, Long> topCongresses,
                              boolean dryRun) {

    public IngestionReport {
        topCongresses = topCongresses == null ? Map.of() : topCongresses;
    }
}
