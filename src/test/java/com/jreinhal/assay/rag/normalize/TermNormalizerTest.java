package com.jreinhal.assay.rag.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TermNormalizerTest {

    private final TermNormalizer normalizer = new TermNormalizer();

    @ParameterizedTest
    @ValueSource(strings = {"10-20 microns", "10 – 20 µm", "1,5 a 2,5 Pa.s", "10 to 20 um", "5 ate 8 microns"})
    @DisplayName("Ranges are detected and left unconverted")
    void rangesAreNotConverted(String raw) {
        Term term = normalizer.normalize(raw);

        assertThat(term.ruleApplied()).isEqualTo(NormalizationRule.RANGE_DETECTED_SKIP);
        assertThat(term.isRangeSkipped()).isTrue();
        assertThat(term.normalized()).doesNotContain("nm").doesNotContain("mpa.s");
    }

    @Test
    void micronsBecomeNanometers() {
        Term term = normalizer.normalize("0.4 microns");

        assertThat(term.normalized()).contains("400 nm");
        assertThat(term.ruleApplied()).isEqualTo(NormalizationRule.MICRON_TO_NM);
        assertThat(term.ruleApplied().tag()).isEqualTo("micron_to_nm");
        assertThat(term.original()).isEqualTo("0.4 microns");
    }

    @Test
    void pascalSecondsBecomeMillipascalSeconds() {
        Term term = normalizer.normalize("2.5 Pa.s");

        assertThat(term.normalized()).contains("2500 mpa.s");
        assertThat(term.ruleApplied()).isEqualTo(NormalizationRule.PAS_TO_MPAS);
    }

    @Test
    void commaDecimalIsConverted() {
        assertThat(normalizer.normalize("0,4 µm").normalized()).contains("400 nm");
    }

    @Test
    void alreadyCanonicalUnitsAreUntouched() {
        Term nm = normalizer.normalize("400 nm");
        Term mpas = normalizer.normalize("2500 mPa.s");

        assertThat(nm.ruleApplied()).isNull();
        assertThat(nm.normalized()).isEqualTo("400 nm");
        assertThat(mpas.ruleApplied()).isNull();
    }

    @Test
    void normalizationIsIdempotent() {
        String once = normalizer.normalize("0.4 microns").normalized();
        Term twice = normalizer.normalize(once);

        assertThat(twice.normalized()).isEqualTo(once);
        assertThat(twice.ruleApplied()).isNull();
    }

    @Test
    void plainTermsAreOnlyFolded() {
        Term term = normalizer.normalize("  Resistência Flexural ");

        assertThat(term.normalized()).isEqualTo("resistencia flexural");
        assertThat(term.ruleApplied()).isNull();
    }
}
