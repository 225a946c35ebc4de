package com.jreinhal.assay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "assay.retrieval")
public class RetrievalProperties {
    /**
     * Weight of the semantic score in the fused score.
     */
    private double semanticWeight = 0.65;

    /**
     * Weight of the full-text score in the fused score.
     */
    private double ftsWeight = 0.35;

    /**
     * Each path fetches {@code limit * candidateMultiplier} candidates before fusion.
     */
    private int candidateMultiplier = 2;

    private int defaultLimit = 15;

    /**
     * Upper bound for scores produced by the substring fallback, so they never outrank structured hits.
     */
    private double substringConfidenceCeiling = 0.3;

    private long pathTimeoutMs = 8000;

    private double semanticSimilarityThreshold = 0.2;

    private int maxSubstringTerms = 10;

    public void validate() {
        if (semanticWeight < 0 || ftsWeight < 0 || Math.abs(semanticWeight + ftsWeight - 1.0) > 1e-6) {
            throw new IllegalStateException("assay.retrieval weights must be non-negative and sum to 1");
        }
        if (substringConfidenceCeiling <= 0 || substringConfidenceCeiling > 1) {
            throw new IllegalStateException("assay.retrieval.substring-confidence-ceiling must be within (0, 1]");
        }
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public double getFtsWeight() {
        return ftsWeight;
    }

    public void setFtsWeight(double ftsWeight) {
        this.ftsWeight = ftsWeight;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public double getSubstringConfidenceCeiling() {
        return substringConfidenceCeiling;
    }

    public void setSubstringConfidenceCeiling(double substringConfidenceCeiling) {
        this.substringConfidenceCeiling = substringConfidenceCeiling;
    }

    public long getPathTimeoutMs() {
        return pathTimeoutMs;
    }

    public void setPathTimeoutMs(long pathTimeoutMs) {
        this.pathTimeoutMs = pathTimeoutMs;
    }

    public double getSemanticSimilarityThreshold() {
        return semanticSimilarityThreshold;
    }

    public void setSemanticSimilarityThreshold(double semanticSimilarityThreshold) {
        this.semanticSimilarityThreshold = semanticSimilarityThreshold;
    }

    public int getMaxSubstringTerms() {
        return maxSubstringTerms;
    }

    public void setMaxSubstringTerms(int maxSubstringTerms) {
        this.maxSubstringTerms = maxSubstringTerms;
    }
}
