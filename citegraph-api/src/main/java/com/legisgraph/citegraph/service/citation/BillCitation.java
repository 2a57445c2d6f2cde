package com.legisgraph.citegraph.service.citation;

public record BillCitation(BillType billType,
                           int number,
                           Integer congress,
                           String original,
                           CitationSpan span) implements ParsedCitation {

    public static String canonicalOf(BillType billType, int number, Integer congress) {
        String base = billType.name() + " " + number;
        return congress == null ? base : base + " (" + congress + "th)";
    }

    @Override
    public CitationFamily family() {
        return CitationFamily.BILL;
    }

    @Override
    public String canonical() {
        return canonicalOf(billType, number, congress);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BillCitation other && canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }
}
