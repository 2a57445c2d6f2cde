package com.legisgraph.citegraph.service.extraction;

import java.util.List;

public interface AmendmentExtractor {

    /**
     * One entry per Public Law occurrence in {@code sourceCredit}, in document order.
     * Blank text or text without a Public Law citation yields an empty list.
     */
    List<ExtractedPublicLaw> extractFromSourceCredit(String sourceCredit, String sectionId);
}
