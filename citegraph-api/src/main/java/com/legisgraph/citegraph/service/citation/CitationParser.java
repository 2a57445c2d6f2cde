package com.legisgraph.citegraph.service.citation;

import java.util.List;

/**
 * Extracts legal citations from free text and reduces each to its canonical string.
 * Text that matches no known citation family is ignored.
 */
public interface CitationParser {

    /**
     * All citations in {@code text}, one per canonical form, ordered by first occurrence.
     */
    List<ParsedCitation> parse(String text);

    /**
     * Every U.S. Code occurrence in document order, duplicates included.
     */
    List<UsCodeCitation> parseUsCode(String text);

    /**
     * Every Public Law occurrence in document order, duplicates included.
     */
    List<PublicLawCitation> parsePublicLaws(String text);

    List<StatutesAtLargeCitation> parseStatutesAtLarge(String text);

    default String normalizeUsCode(int title, String section, String subsection) {
        return UsCodeCitation.canonicalOf(title, section, Subsections.normalize(subsection));
    }

    default String normalizePublicLaw(int congress, int lawNumber) {
        return PublicLawCitation.canonicalOf(congress, lawNumber);
    }

    default String normalizeBill(BillType billType, int number, Integer congress) {
        return BillCitation.canonicalOf(billType, number, congress);
    }

    default String normalizeCfr(int title, int part, String section) {
        return CfrCitation.canonicalOf(title, part, section);
    }
}
