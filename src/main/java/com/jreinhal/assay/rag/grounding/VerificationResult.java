package com.jreinhal.assay.rag.grounding;

import java.util.List;

/**
 * Outcome of checking an answer's numbers against the evidence. {@code ungroundedValues} lists every
 * numeric token that could not be traced, in answer order, even when there were too few of them to
 * fail verification.
 */
public record VerificationResult(boolean verified, List<String> issues, List<String> ungroundedValues) {

    public VerificationResult {
        issues = List.copyOf(issues);
        ungroundedValues = List.copyOf(ungroundedValues);
    }

    public static VerificationResult skipped(String reason) {
        return new VerificationResult(true, List.of("verification skipped: " + reason), List.of());
    }

    public boolean hasUngroundedValues() {
        return !ungroundedValues.isEmpty();
    }
}
