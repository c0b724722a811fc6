package com.jreinhal.legaldoc.reasoning;

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

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs,
                                   Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        CONTEXTUALIZATION,
        ENTITY_EXTRACTION,
        QUERY_EXPANSION,
        HYBRID_RETRIEVAL,
        RERANKING,
        GENERATION,
        VALIDATION,
        RESPONSE,
        ERROR
    }
}
