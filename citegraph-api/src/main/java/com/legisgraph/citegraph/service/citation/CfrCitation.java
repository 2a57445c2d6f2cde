package com.legisgraph.citegraph.service.citation;

public record CfrCitation(int title,
                          int part,
                          String section,
                          String original,
                          CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(int title, int part, String section) {
        String base = title + " CFR " + part;
        return section == null || section.isBlank() ? base : base + "." + section;
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.CFR;
    }

    @Override
    public String canonical() {
        return canonicalOf(title, part, section);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CfrCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
