package com.jreinhal.assay.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetrievalPropertiesTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> new RetrievalProperties().validate()).doesNotThrowAnyException();
        assertThatCode(() -> new AliasResolverProperties().validate()).doesNotThrowAnyException();
    }

    @Test
    void weightsMustSumToOne() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.setSemanticWeight(0.7);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sum to 1");
    }

    @Test
    void substringCeilingMustBePositive() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.setSubstringConfidenceCeiling(0.0);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void aliasThresholdsMustBeFractions() {
        AliasResolverProperties properties = new AliasResolverProperties();
        properties.setEmbeddingAcceptThreshold(1.2);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("embedding-accept-threshold");
    }
}
