package com.legisgraph.citegraph.service.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "citegraph.ingest")
public class IngestionProperties {

    /**
     * Extract source credits on the common fork-join pool. Results keep input order either way.
     */
    private boolean parallelExtraction;

    /**
     * Sections extracted and merged per round before the aggregate is extended.
     */
    private int extractionBatchSize = 1000;

    private String sectionSourceName = "uscode.house.gov";

    private String lawSourceName = "usc_source_credit";

    /**
     * How many congresses the ingestion report ranks by law count.
     */
    private int topCongresses = 10;

    public boolean isParallelExtraction() {
        return parallelExtraction;
    }

    public void setParallelExtraction(boolean parallelExtraction) {
        this.parallelExtraction = parallelExtraction;
    }

    public int getExtractionBatchSize() {
        return extractionBatchSize;
    }

    public void setExtractionBatchSize(int extractionBatchSize) {
        this.extractionBatchSize = extractionBatchSize;
    }

    public String getSectionSourceName() {
        return sectionSourceName;
    }

    public void setSectionSourceName(String sectionSourceName) {
        this.sectionSourceName = sectionSourceName;
    }

    public String getLawSourceName() {
        return lawSourceName;
    }

    public void setLawSourceName(String lawSourceName) {
        this.lawSourceName = lawSourceName;
    }

    public int getTopCongresses() {
        return topCongresses;
    }

    public void setTopCongresses(int topCongresses) {
        this.topCongresses = topCongresses;
    }
}
