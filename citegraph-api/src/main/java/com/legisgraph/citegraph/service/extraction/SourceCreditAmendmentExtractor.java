package com.legisgraph.citegraph.service.extraction;

import com.legisgraph.citegraph.service.citation.CitationParser;
import com.legisgraph.citegraph.service.citation.PublicLawCitation;
import com.legisgraph.citegraph.service.citation.StatutesAtLargeCitation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a section's source credit, e.g.
 * <pre>
 * (Pub. L. 109-58, title IX, sect. 952, Aug. 8, 2005, 119 Stat. 885;
 *  Pub. L. 115-248, sect. 2(b)(1), Sept. 28, 2018, 132 Stat. 3155.)
 * </pre>
 * Each Public Law owns the text from its own citation up to the next semicolon; its date and
 * Statutes at Large citation are only looked for there.
 */
@Component
public class SourceCreditAmendmentExtractor implements AmendmentExtractor {

    private static final Logger log = LoggerFactory.getLogger(SourceCreditAmendmentExtractor.class);

    private final CitationParser citationParser;

    public SourceCreditAmendmentExtractor(CitationParser citationParser) {
        this.citationParser = citationParser;
    }

    @Override
    public List<ExtractedPublicLaw> extractFromSourceCredit(String sourceCredit, String sectionId) {
        if (sourceCredit == null || sourceCredit.isBlank()) {
            return List.of();
        }
        List<PublicLawCitation> citations = citationParser.parsePublicLaws(sourceCredit);
        List<ExtractedPublicLaw> extracted = new ArrayList<>(citations.size());
        for (int position = 0; position < citations.size(); position++) {
            PublicLawCitation citation = citations.get(position);
            String window = contextWindow(sourceCredit, citation.span().start());
            LocalDate enactedDate = EnactmentDates.find(window).orElse(null);
            String statutesAtLarge = citationParser.parseStatutesAtLarge(window).stream()
                    .findFirst()
                    .map(StatutesAtLargeCitation::canonical)
                    .orElse(null);
            extracted.add(ExtractedPublicLaw.observed(
                    citation.congress(), citation.lawNumber(), enactedDate, statutesAtLarge, sectionId, position));
        }
        log.debug("Extracted {} Public Law citations from source credit of {}", extracted.size(), sectionId);
        return List.copyOf(extracted);
    }

    static String contextWindow(String text, int start) {
        int end = text.indexOf(';', start);
        return text.substring(start, end < 0 ? text.length() : end);
    }
}
