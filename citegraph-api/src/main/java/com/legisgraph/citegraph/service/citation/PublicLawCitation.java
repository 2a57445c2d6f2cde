package com.legisgraph.citegraph.service.citation;

public record PublicLawCitation(int congress,
                                int lawNumber,
                                String original,
                                CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(int congress, int lawNumber) {
        return "Pub. L. " + congress + "-" + lawNumber;
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.PUBLIC_LAW;
    }

    @Override
    public String canonical() {
        return canonicalOf(congress, lawNumber);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PublicLawCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
