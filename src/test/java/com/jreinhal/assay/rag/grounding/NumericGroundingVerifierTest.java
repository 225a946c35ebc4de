package com.jreinhal.assay.rag.grounding;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.assay.config.GroundingProperties;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.ExperimentNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.MeasurementNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.VariantNode;
import com.jreinhal.assay.rag.intent.ComplexityTier;
import com.jreinhal.assay.rag.intent.EvidenceMode;
import com.jreinhal.assay.rag.intent.QueryIntent;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NumericGroundingVerifierTest {

    private final NumericGroundingVerifier verifier =
            new NumericGroundingVerifier(new GroundingProperties(), new ReasoningTracer());

    private static final EvidenceGraph GRAPH = new EvidenceGraph("q", List.of("p1"),
            List.of("flexural_strength", "elastic_modulus"),
            List.of(new ExperimentNode("e1", "p1", "Filler series", null, null, LocalDate.of(2024, 2, 1),
                    List.of("doc-1"), List.of(new VariantNode("default", "default", Map.of(), List.of(
                            new MeasurementNode("m1", "flexural_strength", "FS", 131.5, "MPa", 131.5, "MPa", "high",
                                    "FS 131.5 MPa"),
                            new MeasurementNode("m2", "elastic_modulus", "E", 8.2, "GPa", 8200.0, "MPa", "high",
                                    "E = 8.2 GPa")))))),
            List.of(), List.of());

    private static final EvidenceGraph EMPTY = EvidenceGraph.empty("q", List.of("p1"), "none");

    private static QueryIntent intent(boolean navigational, boolean quantitative) {
        return new QueryIntent(false, false, false, navigational, quantitative, List.of(), List.of(), List.of(),
                null, 0, ComplexityTier.SIMPLE, EvidenceMode.CHUNK_ONLY);
    }

    @Nested
    @DisplayName("Grounded answers")
    class Grounded {

        @Test
        void valuesFromMeasurementsPass() {
            VerificationResult result = verifier.verify(
                    "Flexural strength was 131.5 MPa [1] and the modulus 8.2 GPa (8200 MPa) [1].", GRAPH, List.of());

            assertThat(result.verified()).isTrue();
            assertThat(result.issues()).isEmpty();
            assertThat(result.hasUngroundedValues()).isFalse();
        }

        @Test
        void commaDecimalAndToleranceAreAccepted() {
            VerificationResult result = verifier.verify("Resistencia de 131,5 MPa, cerca de 131.8 MPa.", GRAPH, List.of());

            assertThat(result.ungroundedValues()).isEmpty();
        }

        @Test
        void smallIntegersYearsAndCitationMarkersAreNotChecked() {
            VerificationResult result = verifier.verify("In 2023 five of 8 groups [14] [15, 16] met the target.",
                    GRAPH, List.of());

            assertThat(result.ungroundedValues()).isEmpty();
        }

        @Test
        void numbersInSourceTextsCount() {
            VerificationResult result = verifier.verify("Samples were cured for 40 s at 37.5 C.", EMPTY,
                    List.of("Light curing 40 s, storage at 37.5 C"));

            assertThat(result.ungroundedValues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Ungrounded answers")
    class Ungrounded {

        @Test
        void fabricatedValuesFailVerification() {
            VerificationResult result = verifier.verify(
                    "Flexural strength was 131.5 MPa, hardness 55.3 HV, release 28.7 µg and modulus 12.4 GPa.",
                    GRAPH, List.of());

            assertThat(result.verified()).isFalse();
            assertThat(result.ungroundedValues()).containsExactly("55.3", "28.7", "12.4");
            assertThat(result.issues()).singleElement().asString()
                    .startsWith("NUMERIC_GROUNDING_FAILED: 3 numeric values not traceable to evidence")
                    .contains("55.3", "28.7", "12.4");
        }

        @Test
        void fewUngroundedValuesStillPassButAreReported() {
            VerificationResult result = verifier.verify("Hardness was 55.3 HV and 61.2 HV.", GRAPH, List.of());

            assertThat(result.verified()).isTrue();
            assertThat(result.ungroundedValues()).containsExactly("55.3", "61.2");
        }

        @Test
        void repeatedValueIsCountedEachTime() {
            VerificationResult result = verifier.verify("55.3 then 55.3 then 55.3 again", GRAPH, List.of());

            assertThat(result.verified()).isFalse();
            assertThat(result.ungroundedValues()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Verification policy")
    class Policy {

        @Test
        void navigationalQueryWithoutMeasurementsIsSkipped() {
            VerificationResult result = verifier.verify("There are 42 projects.", EMPTY, List.of(), intent(true, false));

            assertThat(result.verified()).isTrue();
            assertThat(result.issues()).containsExactly("verification skipped: non-quantitative query");
        }

        @Test
        void quantitativeQueryIsChecked() {
            VerificationResult result = verifier.verify("Values: 42.1, 43.2 and 44.3.", EMPTY, List.of(), intent(false, true));

            assertThat(result.verified()).isFalse();
        }

        @Test
        void graphWithMeasurementsIsAlwaysChecked() {
            VerificationResult result = verifier.verify("Values: 42.1, 43.2 and 44.3.", GRAPH, List.of(), intent(true, false));

            assertThat(result.verified()).isFalse();
        }
    }

    @Test
    void groundedValuesListRawAndCanonicalForms() {
        assertThat(NumericGroundingVerifier.groundedValues(GRAPH))
                .containsExactly("131.5 MPa", "8.2 GPa", "8200 MPa");
    }
}
