package com.jreinhal.assay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds for mapping free-text terms onto catalog canonical keys.
 */
@Component
@ConfigurationProperties(prefix = "assay.alias")
public class AliasResolverProperties {
    /**
     * Minimum trigram (Dice) similarity for a fuzzy match to be considered.
     */
    private double trigramAcceptThreshold = 0.55;

    /**
     * Minimum cosine similarity for the embedding fallback.
     */
    private double embeddingAcceptThreshold = 0.80;

    /**
     * A best candidate must beat the runner-up by at least this margin, otherwise the term is ambiguous.
     */
    private double ambiguityDelta = 0.05;

    private boolean embeddingFallbackEnabled = true;

    /**
     * How long a catalog snapshot read from Mongo is reused.
     */
    private long catalogTtlSeconds = 300;

    /**
     * Record fuzzy matches as unapproved alias suggestions.
     */
    private boolean suggestionsEnabled = true;

    private long resolveTimeoutMs = 5000;

    public void validate() {
        requireUnit("trigram-accept-threshold", trigramAcceptThreshold);
        requireUnit("embedding-accept-threshold", embeddingAcceptThreshold);
        requireUnit("ambiguity-delta", ambiguityDelta);
    }

    private static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalStateException("assay.alias." + name + " must be within [0, 1] but was " + value);
        }
    }

    public double getTrigramAcceptThreshold() {
        return trigramAcceptThreshold;
    }

    public void setTrigramAcceptThreshold(double trigramAcceptThreshold) {
        this.trigramAcceptThreshold = trigramAcceptThreshold;
    }

    public double getEmbeddingAcceptThreshold() {
        return embeddingAcceptThreshold;
    }

    public void setEmbeddingAcceptThreshold(double embeddingAcceptThreshold) {
        this.embeddingAcceptThreshold = embeddingAcceptThreshold;
    }

    public double getAmbiguityDelta() {
        return ambiguityDelta;
    }

    public void setAmbiguityDelta(double ambiguityDelta) {
        this.ambiguityDelta = ambiguityDelta;
    }

    public boolean isEmbeddingFallbackEnabled() {
        return embeddingFallbackEnabled;
    }

    public void setEmbeddingFallbackEnabled(boolean embeddingFallbackEnabled) {
        this.embeddingFallbackEnabled = embeddingFallbackEnabled;
    }

    public long getCatalogTtlSeconds() {
        return catalogTtlSeconds;
    }

    public void setCatalogTtlSeconds(long catalogTtlSeconds) {
        this.catalogTtlSeconds = catalogTtlSeconds;
    }

    public boolean isSuggestionsEnabled() {
        return suggestionsEnabled;
    }

    public void setSuggestionsEnabled(boolean suggestionsEnabled) {
        this.suggestionsEnabled = suggestionsEnabled;
    }

    public long getResolveTimeoutMs() {
        return resolveTimeoutMs;
    }

    public void setResolveTimeoutMs(long resolveTimeoutMs) {
        this.resolveTimeoutMs = resolveTimeoutMs;
    }
}
