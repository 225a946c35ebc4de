package com.jreinhal.assay.rag.normalize;

/**
 * Tags of the normalization rules. {@link #tag()} is the value reported to callers.
 */
public enum NormalizationRule {
    RANGE_DETECTED_SKIP("range_detected_skip"),
    MICRON_TO_NM("micron_to_nm"),
    PAS_TO_MPAS("pas_to_mpas");

    private final String tag;

    NormalizationRule(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
