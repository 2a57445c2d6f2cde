package com.legisgraph.citegraph.service.lineage;

public class SectionNotFoundException extends RuntimeException {

    private final String sectionId;

    public SectionNotFoundException(String sectionId) {
        super("Section " + sectionId + " not found");
        this.sectionId = sectionId;
    }

    public String sectionId() {
        return sectionId;
    }
}
