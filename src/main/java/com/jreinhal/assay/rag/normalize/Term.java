package com.jreinhal.assay.rag.normalize;

/**
 * A query term before and after normalization. {@code ruleApplied} is {@code null} when no rule fired.
 */
public record Term(String original, String normalized, NormalizationRule ruleApplied) {

    public boolean isRangeSkipped() {
        return ruleApplied == NormalizationRule.RANGE_DETECTED_SKIP;
    }
}
