package com.legisgraph.citegraph.service.extraction;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublicLawMergerTest {

    private final PublicLawMerger merger = new PublicLawMerger();

    @Test
    void unionsSectionsAndPositionsOfTheSameLaw() {
        ExtractedPublicLaw inSectionA = ExtractedPublicLaw.observed(111, 148, null, null, "42 USC 1395", 1);
        ExtractedPublicLaw inSectionB = ExtractedPublicLaw.observed(111, 148, LocalDate.of(2010, 3, 23), "124 Stat. 119", "42 USC 18001", 0);

        Map<String, ExtractedPublicLaw> merged = merger.merge(List.of(inSectionA, inSectionB));

        assertThat(merged).containsOnlyKeys("Pub. L. 111-148");
        ExtractedPublicLaw law = merged.get("Pub. L. 111-148");
        assertThat(law.sourceSectionIds()).containsExactly("42 USC 1395", "42 USC 18001");
        assertThat(law.positionInSource()).containsEntry("42 USC 1395", 1).containsEntry("42 USC 18001", 0);
        assertThat(law.enactedDate()).isEqualTo(LocalDate.of(2010, 3, 23));
        assertThat(law.statutesAtLarge()).isEqualTo("124 Stat. 119");
    }

    @Test
    void firstNonNullValueWins() {
        ExtractedPublicLaw first = ExtractedPublicLaw.observed(89, 97, LocalDate.of(1965, 7, 30), "79 Stat. 286", "42 USC 1395", 0);
        ExtractedPublicLaw second = ExtractedPublicLaw.observed(89, 97, LocalDate.of(1965, 7, 31), "79 Stat. 291", "42 USC 1395a", 0);

        ExtractedPublicLaw law = merger.merge(List.of(first, second)).get("Pub. L. 89-97");

        assertThat(law.enactedDate()).isEqualTo(LocalDate.of(1965, 7, 30));
        assertThat(law.statutesAtLarge()).isEqualTo("79 Stat. 286");
    }

    @Test
    void repeatedCitationInOneSectionKeepsEarliestPosition() {
        ExtractedPublicLaw enacting = ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395", 0);
        ExtractedPublicLaw repeated = ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395", 3);

        assertThat(merger.merge(List.of(enacting, repeated)).get("Pub. L. 89-97").positionIn("42 USC 1395")).hasValue(0);
        assertThat(merger.merge(List.of(repeated, enacting)).get("Pub. L. 89-97").positionIn("42 USC 1395")).hasValue(0);
    }

    @Test
    void mergeIsIdempotent() {
        List<ExtractedPublicLaw> extracted = List.of(
                ExtractedPublicLaw.observed(89, 97, LocalDate.of(1965, 7, 30), null, "42 USC 1395", 0),
                ExtractedPublicLaw.observed(111, 148, null, "124 Stat. 119", "42 USC 1395", 1),
                ExtractedPublicLaw.observed(89, 97, null, "79 Stat. 286", "42 USC 1395a", 0));

        Map<String, ExtractedPublicLaw> once = merger.merge(extracted);
        List<ExtractedPublicLaw> doubled = new ArrayList<>(extracted);
        doubled.addAll(extracted);

        assertThat(merger.merge(once.values())).isEqualTo(once);
        assertThat(merger.merge(doubled)).isEqualTo(once);
        assertThat(once.keySet()).containsExactly("Pub. L. 89-97", "Pub. L. 111-148");
    }

    @Test
    void doesNotMutateInputs() {
        ExtractedPublicLaw first = ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395", 0);
        ExtractedPublicLaw second = ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395a", 0);

        merger.merge(List.of(first, second));

        assertThat(first.sourceSectionIds()).containsExactly("42 USC 1395");
        assertThat(first.positionInSource()).hasSize(1);
    }

    @Test
    void mergeIntoExtendsAnExistingAggregate() {
        Map<String, ExtractedPublicLaw> existing = merger.merge(List.of(
                ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395", 0)));

        Map<String, ExtractedPublicLaw> extended = merger.mergeInto(existing, List.of(
                ExtractedPublicLaw.observed(89, 97, LocalDate.of(1965, 7, 30), null, "42 USC 1395b", 2),
                ExtractedPublicLaw.observed(90, 248, null, null, "42 USC 1395b", 3)));

        assertThat(extended).containsOnlyKeys("Pub. L. 89-97", "Pub. L. 90-248");
        assertThat(extended.get("Pub. L. 89-97").sourceSectionIds()).containsExactly("42 USC 1395", "42 USC 1395b");
        assertThat(extended.get("Pub. L. 89-97").enactedDate()).isEqualTo(LocalDate.of(1965, 7, 30));
        assertThat(existing.get("Pub. L. 89-97").sourceSectionIds()).containsExactly("42 USC 1395");
    }

    @Test
    void refusesToAbsorbADifferentLaw() {
        ExtractedPublicLaw law = ExtractedPublicLaw.observed(89, 97, null, null, "42 USC 1395", 0);

        assertThatThrownBy(() -> law.absorb(ExtractedPublicLaw.observed(89, 98, null, null, "42 USC 1395", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
