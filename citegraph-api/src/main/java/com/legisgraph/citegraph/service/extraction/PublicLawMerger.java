package com.legisgraph.citegraph.service.extraction;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collapses per-section extractions of the same Public Law into one aggregate keyed by
 * canonical id. Processing follows the iteration order of the input, which decides which
 * date or Stat citation is kept when observations disagree.
 */
@Component
public class PublicLawMerger {

    public Map<String, ExtractedPublicLaw> merge(Collection<ExtractedPublicLaw> extracted) {
        return mergeInto(Map.of(), extracted);
    }

    public Map<String, ExtractedPublicLaw> mergeInto(Map<String, ExtractedPublicLaw> existing,
                                                     Collection<ExtractedPublicLaw> incoming) {
        Map<String, ExtractedPublicLaw> merged = new LinkedHashMap<>(existing == null ? Map.of() : existing);
        if (incoming != null) {
            for (ExtractedPublicLaw law : incoming) {
                merged.merge(law.canonicalId(), law, ExtractedPublicLaw::absorb);
            }
        }
        return Collections.unmodifiableMap(merged);
    }
}
