package com.legisgraph.citegraph.service.citation;

import java.util.List;

public record UsCodeCitation(int title,
                             String section,
                             String subsection,
                             String original,
                             CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(int title, String section, String subsection) {
        String base = title + " USC " + section;
        return subsection == null || subsection.isBlank() ? base : base + "(" + subsection + ")";
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.US_CODE;
    }

    @Override
    public String canonical() {
        return canonicalOf(title, section, subsection);
    }

    public List<String> subsectionParts() {
        return Subsections.parts(subsection);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UsCodeCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
