package com.legisgraph.citegraph.service.citation;

public record FederalRegisterCitation(int volume,
                                      int page,
                                      String original,
                                      CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(int volume, int page) {
        return volume + " FR " + page;
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.FEDERAL_REGISTER;
    }

    @Override
    public String canonical() {
        return canonicalOf(volume, page);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FederalRegisterCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
