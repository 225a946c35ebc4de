package com.jreinhal.assay.reasoning;

import java.util.Map;

/**
 * One pipeline stage as recorded in a {@link ReasoningTrace}.
 */
public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        QUERY_ANALYSIS,
        ALIAS_RESOLUTION,
        QUERY_ROUTING,
        HYBRID_RETRIEVAL,
        EVIDENCE_GRAPH,
        DOCUMENT_SELECTION,
        PROMPT_ASSEMBLY,
        GENERATION,
        VERIFICATION,
        REGENERATION,
        ANSWER_ASSEMBLY,
        FAIL_CLOSED,
        ERROR
    }
}
