package com.legisgraph.citegraph.service.citation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegexCitationParserTest {

    private final RegexCitationParser parser = new RegexCitationParser();

    @Test
    void parsesStandardUsCodeCitation() {
        List<ParsedCitation> citations = parser.parse("See 42 U.S.C. § 1395 for details.");

        assertThat(citations).hasSize(1);
        UsCodeCitation citation = (UsCodeCitation) citations.get(0);
        assertThat(citation.family()).isEqualTo(CitationFamily.US_CODE);
        assertThat(citation.canonical()).isEqualTo("42 USC 1395");
        assertThat(citation.title()).isEqualTo(42);
        assertThat(citation.section()).isEqualTo("1395");
        assertThat(citation.original()).isEqualTo("42 U.S.C. § 1395");
        assertThat(citation.span()).isEqualTo(new CitationSpan(4, 20));
    }

    @ParameterizedTest
    @ValueSource(strings = {"42 U.S.C. § 1395", "42 U.S.C. §1395", "42 U.S.C.§1395", "42U.S.C.§1395", "42 USC 1395", "42 usc sec. 1395"})
    void acceptsSpacingAndSeparatorVariants(String text) {
        List<UsCodeCitation> citations = parser.parseUsCode(text);

        assertThat(citations).hasSize(1);
        assertThat(citations.get(0).title()).isEqualTo(42);
        assertThat(citations.get(0).section()).isEqualTo("1395");
    }

    @Test
    void keepsLetterSuffixesAndHyphenatedSections() {
        assertThat(parser.parse("Under 42 USC 1395a...")).extracting(ParsedCitation::canonical)
                .containsExactly("42 USC 1395a");
        assertThat(parser.parse("see 42 U.S.C. 1395b-1")).extracting(ParsedCitation::canonical)
                .containsExactly("42 USC 1395b-1");
    }

    @Test
    void normalizesSubsections() {
        UsCodeCitation single = (UsCodeCitation) parser.parse("Per 42 U.S.C. § 1395(a)(1)...").get(0);
        UsCodeCitation nested = (UsCodeCitation) parser.parse("See 42 U.S.C. § 1395(a)(1)(A).").get(0);

        assertThat(single.subsection()).isEqualTo("a.1");
        assertThat(single.canonical()).isEqualTo("42 USC 1395(a.1)");
        assertThat(nested.subsection()).isEqualTo("a.1.A");
        assertThat(nested.subsectionParts()).containsExactly("a", "1", "A");
    }

    @Test
    void consumesEtSeqWithoutCanonicalizingIt() {
        List<ParsedCitation> citations = parser.parse("Governed by 26 U.S.C. § 5000A et seq.");

        assertThat(citations).extracting(ParsedCitation::canonical).containsExactly("26 USC 5000A");
        assertThat(citations.get(0).original()).endsWith("et seq.");
    }

    @Test
    void parsesInvertedUsCodeForm() {
        List<ParsedCitation> citations = parser.parse("as provided in section 1395(b) of title 42");

        assertThat(citations).extracting(ParsedCitation::canonical).containsExactly("42 USC 1395(b)");
    }

    @Test
    void parsesPublicLawSpellings() {
        PublicLawCitation citation = (PublicLawCitation) parser.parse("Enacted by Pub. L. 111-148").get(0);
        assertThat(citation.canonical()).isEqualTo("Pub. L. 111-148");
        assertThat(citation.congress()).isEqualTo(111);
        assertThat(citation.lawNumber()).isEqualTo(148);

        assertThat(parser.parse("P.L. 111-148")).extracting(ParsedCitation::canonical).containsExactly("Pub. L. 111-148");
        assertThat(parser.parse("Public Law 111-148")).extracting(ParsedCitation::canonical).containsExactly("Pub. L. 111-148");
        assertThat(parser.parse("Pub. L. No. 89-97")).extracting(ParsedCitation::canonical).containsExactly("Pub. L. 89-97");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Pub. L. 111-148", "Pub. L. 111–148", "Pub. L. 111—148"})
    void acceptsAnyDashInPublicLaws(String text) {
        assertThat(parser.parsePublicLaws(text)).extracting(PublicLawCitation::canonical)
                .containsExactly("Pub. L. 111-148");
    }

    @Test
    void parsesBills() {
        BillCitation house = (BillCitation) parser.parse("H.R. 3590").get(0);
        assertThat(house.billType()).isEqualTo(BillType.HR);
        assertThat(house.number()).isEqualTo(3590);
        assertThat(house.congress()).isNull();
        assertThat(house.canonical()).isEqualTo("HR 3590");

        BillCitation withCongress = (BillCitation) parser.parse("H.R. 3590 (111th Congress)").get(0);
        assertThat(withCongress.congress()).isEqualTo(111);
        assertThat(withCongress.canonical()).isEqualTo("HR 3590 (111th)");

        assertThat(((BillCitation) parser.parse("S. 1234").get(0)).billType()).isEqualTo(BillType.S);
        assertThat(((BillCitation) parser.parse("H.J. Res. 114").get(0)).billType()).isEqualTo(BillType.HJRES);
        assertThat(((BillCitation) parser.parse("S. Con. Res. 70").get(0)).billType()).isEqualTo(BillType.SCONRES);
        assertThat(((BillCitation) parser.parse("S.Con.Res. 70").get(0)).canonical()).isEqualTo("SCONRES 70");
    }

    @Test
    void parsesCfrCitations() {
        CfrCitation citation = (CfrCitation) parser.parse("42 CFR 405.1").get(0);
        assertThat(citation.canonical()).isEqualTo("42 CFR 405.1");
        assertThat(citation.title()).isEqualTo(42);
        assertThat(citation.part()).isEqualTo(405);
        assertThat(citation.section()).isEqualTo("1");

        assertThat(parser.parse("42 C.F.R. § 405.1")).extracting(ParsedCitation::canonical).containsExactly("42 CFR 405.1");
        assertThat(parser.parse("42 CFR Part 405")).extracting(ParsedCitation::canonical).containsExactly("42 CFR 405");
    }

    @Test
    void parsesFederalRegisterAndStatutesAtLarge() {
        FederalRegisterCitation register = (FederalRegisterCitation) parser.parse("78 FR 5566").get(0);
        assertThat(register.volume()).isEqualTo(78);
        assertThat(register.page()).isEqualTo(5566);
        assertThat(parser.parse("78 Fed. Reg. 5566")).extracting(ParsedCitation::canonical).containsExactly("78 FR 5566");

        StatutesAtLargeCitation statute = (StatutesAtLargeCitation) parser.parse("79 Stat. 286").get(0);
        assertThat(statute.volume()).isEqualTo(79);
        assertThat(statute.page()).isEqualTo(286);
        assertThat(parser.parse("79 Stat 286")).extracting(ParsedCitation::canonical).containsExactly("79 Stat. 286");
    }

    @Test
    void findsEveryFamilyInMixedTextInDocumentOrder() {
        String text = """
                Section 1395 of title 42 was enacted by Pub. L. 89-97, 79 Stat. 286.
                It has been amended multiple times, most recently by P.L. 111-148.
                See also 42 CFR 405.1 for implementing regulations and 78 FR 5566
                for the latest rulemaking. The bill H.R. 3590 (111th Congress) was
                the vehicle for the Affordable Care Act amendments.
                """;

        List<ParsedCitation> citations = parser.parse(text);

        assertThat(citations).extracting(ParsedCitation::canonical).containsExactly(
                "42 USC 1395",
                "Pub. L. 89-97",
                "79 Stat. 286",
                "Pub. L. 111-148",
                "42 CFR 405.1",
                "78 FR 5566",
                "HR 3590 (111th)");
        assertThat(citations).isSortedAccordingTo((a, b) -> Integer.compare(a.span().start(), b.span().start()));
    }

    @Test
    void deduplicatesByCanonicalKeepingFirstOccurrence() {
        List<ParsedCitation> citations = parser.parse("42 U.S.C. § 1395 is important. See also 42 USC 1395.");

        assertThat(citations).hasSize(1);
        assertThat(citations.get(0).original()).isEqualTo("42 U.S.C. § 1395");
        assertThat(citations.get(0).span().start()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "See 40 CFR 12345678901 for details.",
            "Pub. L. 111-1234567890123",
            "99999999999 Stat. 1",
            "H.R. 99999999999 (111th Congress)",
            "123456789012 FR 5566"})
    void skipsNumbersTooLongForAnyCitation(String text) {
        assertThat(parser.parse(text)).isEmpty();
    }

    @Test
    void keepsCfrCitationNextToOverlongNumber() {
        assertThat(parser.parse("40 CFR 12345678901 and 40 CFR 60.1"))
                .extracting(ParsedCitation::canonical)
                .containsExactly("40 CFR 60.1");
    }

    @Test
    void familySpecificParsingKeepsDuplicates() {
        assertThat(parser.parsePublicLaws("Pub. L. 89-97; Pub. L. 89-97")).hasSize(2);
        assertThat(parser.parseUsCode("42 USC 1395 and 42 U.S.C. 1395")).hasSize(2);
    }

    @Test
    void ignoresTextWithoutCitations() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("This is just regular text with no legal citations.")).isEmpty();
        assertThat(parser.parse("Section 42 is not a USC citation. Neither is USC alone."))
                .noneMatch(citation -> citation.family() == CitationFamily.US_CODE);
    }

    @Test
    void findsRealCitationNextToUrlLookalike() {
        assertThat(parser.parse("See https://example.com/42-usc-1395 but also 42 USC 1395."))
                .extracting(ParsedCitation::canonical)
                .contains("42 USC 1395");
    }

    @Test
    void identityIgnoresSpanAndSpelling() {
        UsCodeCitation first = parser.parseUsCode("42 U.S.C. § 1395").get(0);
        UsCodeCitation second = parser.parseUsCode("text 42 USC 1395").get(0);

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.span()).isNotEqualTo(second.span());
    }

    @Test
    void canonicalStringsReparseToThemselves() {
        for (String canonical : List.of("42 USC 1395(a.1)", "Pub. L. 111-148", "HR 3590 (111th)",
                "42 CFR 405.1", "78 FR 5566", "79 Stat. 286")) {
            assertThat(parser.parse(canonical)).extracting(ParsedCitation::canonical).containsExactly(canonical);
        }
    }

    @Test
    void normalizersProduceCanonicalForms() {
        assertThat(parser.normalizeUsCode(42, "1395", null)).isEqualTo("42 USC 1395");
        assertThat(parser.normalizeUsCode(42, "1395", "a.1")).isEqualTo("42 USC 1395(a.1)");
        assertThat(parser.normalizeUsCode(42, "1395", "(a)(1)")).isEqualTo("42 USC 1395(a.1)");
        assertThat(parser.normalizePublicLaw(111, 148)).isEqualTo("Pub. L. 111-148");
        assertThat(parser.normalizeBill(BillType.fromAlias("hr").orElseThrow(), 3590, 111)).isEqualTo("HR 3590 (111th)");
        assertThat(parser.normalizeBill(BillType.fromAlias("H.R.").orElseThrow(), 3590, null)).isEqualTo("HR 3590");
        assertThat(parser.normalizeCfr(42, 405, null)).isEqualTo("42 CFR 405");
        assertThat(parser.normalizeCfr(42, 405, "1")).isEqualTo("42 CFR 405.1");
    }
}
