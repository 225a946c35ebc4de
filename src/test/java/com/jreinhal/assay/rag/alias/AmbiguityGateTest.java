package com.jreinhal.assay.rag.alias;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.assay.rag.alias.AmbiguityGate.Decision;
import org.junit.jupiter.api.Test;

class AmbiguityGateTest {

    @Test
    void closeRunnerUpIsAmbiguous() {
        assertThat(AmbiguityGate.evaluate(0.82, 0.79, 0.55, 0.05)).isEqualTo(Decision.AMBIGUOUS);
    }

    @Test
    void clearWinnerIsAccepted() {
        assertThat(AmbiguityGate.evaluate(0.85, 0.60, 0.55, 0.05)).isEqualTo(Decision.ACCEPT);
    }

    @Test
    void bestBelowThresholdIsRejected() {
        assertThat(AmbiguityGate.evaluate(0.50, 0.10, 0.55, 0.05)).isEqualTo(Decision.REJECT);
    }

    @Test
    void marginExactlyAtDeltaIsAccepted() {
        assertThat(AmbiguityGate.evaluate(0.80, 0.75, 0.55, 0.05)).isEqualTo(Decision.ACCEPT);
    }
}
