package com.legisgraph.citegraph.service.citation;

/**
 * One recognised citation occurrence.
 * <p>
 * Implementations compare equal when their canonical strings are equal. The span and the
 * original spelling never take part in identity.
 */
public sealed interface ParsedCitation
        permits UsCodeCitation, PublicLawCitation, BillCitation, CfrCitation,
                FederalRegisterCitation, StatutesAtLargeCitation {

    CitationFamily family();

    String canonical();

    String original();

    CitationSpan span();
}
