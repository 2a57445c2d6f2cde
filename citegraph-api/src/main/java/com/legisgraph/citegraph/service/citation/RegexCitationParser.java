package com.legisgraph.citegraph.service.citation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based {@link CitationParser}. Each family is matched independently over the whole
 * text; the results are then ordered by position and collapsed by canonical form.
 */
@Component
public class RegexCitationParser implements CitationParser {

    private static final Logger log = LoggerFactory.getLogger(RegexCitationParser.class);

    private static final String SECTION_NUMBER = "(\\d+[a-z]*(?:-\\d+[a-z]*)?)";
    private static final String SUBSECTIONS = "(?:\\s*\\(([^)]+(?:\\)\\s*\\([^)]+)*)\\))?";

    // 42 U.S.C. § 1395(a)(1), 42 USC 1395a, 26 U.S.C. 5000A et seq.
    private static final Pattern US_CODE = Pattern.compile(
            "\\b(\\d{1,2})\\s*"
                    + "U\\.?\\s*S\\.?\\s*C\\.?\\s*"
                    + "(?:§+\\s*|sections?\\s+|sec\\.?\\s+)?"
                    + SECTION_NUMBER
                    + SUBSECTIONS
                    + "(?:\\s+et\\s+seq\\.?)?",
            Pattern.CASE_INSENSITIVE);

    // section 1395(b) of title 42
    private static final Pattern US_CODE_INVERTED = Pattern.compile(
            "\\bsections?\\s+" + SECTION_NUMBER
                    + SUBSECTIONS
                    + "\\s+of\\s+title\\s+(\\d{1,2})\\b",
            Pattern.CASE_INSENSITIVE);

    // Pub. L. 111-148, P.L. 111-148, Public Law 111–148, Pub. L. No. 89-97
    private static final Pattern PUBLIC_LAW = Pattern.compile(
            "\\b(?:Pub(?:lic)?\\.?\\s*L(?:aw)?\\.?\\s*(?:No\\.?\\s*)?|P\\.?\\s*L\\.?\\s*)"
                    + "(\\d{1,3})\\s*[-–—]\\s*(\\d{1,4})\\b",
            Pattern.CASE_INSENSITIVE);

    // H.R. 3590 (111th Congress), S. 1234, H.J. Res. 114, S. Con. Res. 70
    private static final Pattern BILL = Pattern.compile(
            "\\b(H\\.?\\s*R\\.?|S\\.?|H\\.?\\s*J\\.?\\s*Res\\.?|S\\.?\\s*J\\.?\\s*Res\\.?|"
                    + "H\\.?\\s*Con\\.?\\s*Res\\.?|S\\.?\\s*Con\\.?\\s*Res\\.?|"
                    + "H\\.?\\s*Res\\.?|S\\.?\\s*Res\\.?)"
                    + "\\s*(\\d{1,5})\\b"
                    + "(?:\\s*\\((\\d{2,3})(?:th|st|nd|rd)?\\s*(?:Congress|Cong\\.?)?\\))?",
            Pattern.CASE_INSENSITIVE);

    // 42 CFR 405.1, 42 C.F.R. § 405.1, 42 CFR Part 405
    private static final Pattern CFR = Pattern.compile(
            "\\b(\\d{1,2})\\s*"
                    + "C\\.?\\s*F\\.?\\s*R\\.?\\s*"
                    + "(?:§+\\s*|Part\\s+|sections?\\s+|sec\\.?\\s+)?"
                    + "(\\d{1,6})(?!\\d)"
                    + "(?:\\.(\\d+[a-z]*))?",
            Pattern.CASE_INSENSITIVE);

    // 78 FR 5566, 78 Fed. Reg. 5566
    private static final Pattern FEDERAL_REGISTER = Pattern.compile(
            "\\b(\\d{1,3})\\s*(?:Fed\\.?\\s*Reg\\.?|FR)\\s*(\\d{1,6})\\b",
            Pattern.CASE_INSENSITIVE);

    // 79 Stat. 286, 79 Stat 286
    private static final Pattern STATUTES_AT_LARGE = Pattern.compile(
            "\\b(\\d{1,3})\\s*Stat\\.?\\s*(\\d{1,5})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Comparator<ParsedCitation> DOCUMENT_ORDER = Comparator
            .comparingInt((ParsedCitation citation) -> citation.span().start())
            .thenComparing(ParsedCitation::family);

    @Override
    public List<ParsedCitation> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<ParsedCitation> all = new ArrayList<>();
        for (CitationFamily family : CitationFamily.values()) {
            all.addAll(parseFamily(family, text));
        }
        all.sort(DOCUMENT_ORDER);

        Set<String> seen = new HashSet<>();
        List<ParsedCitation> unique = new ArrayList<>();
        for (ParsedCitation citation : all) {
            if (seen.add(citation.canonical())) {
                unique.add(citation);
            }
        }
        log.debug("Parsed {} citations ({} unique) from {} characters", all.size(), unique.size(), text.length());
        return List.copyOf(unique);
    }

    @Override
    public List<UsCodeCitation> parseUsCode(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<UsCodeCitation> citations = new ArrayList<>();
        Matcher standard = US_CODE.matcher(text);
        while (standard.find()) {
            citations.add(new UsCodeCitation(
                    Integer.parseInt(standard.group(1)),
                    standard.group(2),
                    Subsections.normalize(standard.group(3)),
                    standard.group(),
                    spanOf(standard)));
        }
        Matcher inverted = US_CODE_INVERTED.matcher(text);
        while (inverted.find()) {
            citations.add(new UsCodeCitation(
                    Integer.parseInt(inverted.group(3)),
                    inverted.group(1),
                    Subsections.normalize(inverted.group(2)),
                    inverted.group(),
                    spanOf(inverted)));
        }
        citations.sort(Comparator.comparingInt(citation -> citation.span().start()));
        return List.copyOf(citations);
    }

    @Override
    public List<PublicLawCitation> parsePublicLaws(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<PublicLawCitation> citations = new ArrayList<>();
        Matcher matcher = PUBLIC_LAW.matcher(text);
        while (matcher.find()) {
            citations.add(new PublicLawCitation(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    matcher.group(),
                    spanOf(matcher)));
        }
        return List.copyOf(citations);
    }

    @Override
    public List<StatutesAtLargeCitation> parseStatutesAtLarge(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<StatutesAtLargeCitation> citations = new ArrayList<>();
        Matcher matcher = STATUTES_AT_LARGE.matcher(text);
        while (matcher.find()) {
            citations.add(new StatutesAtLargeCitation(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    matcher.group(),
                    spanOf(matcher)));
        }
        return List.copyOf(citations);
    }

    private List<? extends ParsedCitation> parseFamily(CitationFamily family, String text) {
        return switch (family) {
            case US_CODE -> parseUsCode(text);
            case PUBLIC_LAW -> parsePublicLaws(text);
            case BILL -> parseBills(text);
            case CFR -> parseCfr(text);
            case FEDERAL_REGISTER -> parseFederalRegister(text);
            case STATUTES_AT_LARGE -> parseStatutesAtLarge(text);
        };
    }

    private List<BillCitation> parseBills(String text) {
        List<BillCitation> citations = new ArrayList<>();
        Matcher matcher = BILL.matcher(text);
        while (matcher.find()) {
            Optional<BillType> billType = BillType.fromAlias(matcher.group(1));
            if (billType.isEmpty()) {
                log.debug("Ignoring bill designator '{}' with unknown type", matcher.group());
                continue;
            }
            Integer congress = matcher.group(3) == null ? null : Integer.valueOf(matcher.group(3));
            citations.add(new BillCitation(
                    billType.get(),
                    Integer.parseInt(matcher.group(2)),
                    congress,
                    matcher.group(),
                    spanOf(matcher)));
        }
        return citations;
    }

    private List<CfrCitation> parseCfr(String text) {
        List<CfrCitation> citations = new ArrayList<>();
        Matcher matcher = CFR.matcher(text);
        while (matcher.find()) {
            citations.add(new CfrCitation(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    matcher.group(3),
                    matcher.group(),
                    spanOf(matcher)));
        }
        return citations;
    }

    private List<FederalRegisterCitation> parseFederalRegister(String text) {
        List<FederalRegisterCitation> citations = new ArrayList<>();
        Matcher matcher = FEDERAL_REGISTER.matcher(text);
        while (matcher.find()) {
            citations.add(new FederalRegisterCitation(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    matcher.group(),
                    spanOf(matcher)));
        }
        return citations;
    }

    private CitationSpan spanOf(Matcher matcher) {
        return new CitationSpan(matcher.start(), matcher.end());
    }
}
