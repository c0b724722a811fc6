package com.jreinhal.legaldoc.exception;

/**
 * Failure classes a pipeline stage can report. Each one maps to a degraded outcome in the
 * orchestrator rather than an error returned to the caller.
 */
public enum StageFailure {
    /** Entity extraction failed; continue with the unexpanded query. */
    EXTRACTION_FAILURE,
    /** Neither index produced a candidate; answer with the insufficient-information text. */
    RETRIEVAL_EMPTY,
    /** Cross-encoder scoring failed; keep the fused order. */
    RERANK_FAILURE,
    /** Answer model failed or timed out; retry once, then suppress. */
    GENERATION_FAILURE,
    /** Claim checking failed; treat the draft as unsupported. */
    VALIDATION_FAILURE
}
