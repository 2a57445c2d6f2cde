package com.legisgraph.citegraph.service.citation;

public record StatutesAtLargeCitation(int volume,
                                      int page,
                                      String original,
                                      CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(int volume, int page) {
        return volume + " Stat. " + page;
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.STATUTES_AT_LARGE;
    }

    @Override
    public String canonical() {
        return canonicalOf(volume, page);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StatutesAtLargeCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
