package com.legisgraph.citegraph.model;

import com.legisgraph.citegraph.service.citation.CitationFamily;
import com.legisgraph.citegraph.service.citation.ParsedCitation;

public record CitationView(CitationFamily family, String canonical, String original, int start, int end) {

    public static CitationView from(ParsedCitation citation) {
        return new CitationView(citation.family(), citation.canonical(), citation.original(),
                citation.span().start(), citation.span().end());
    }
}
