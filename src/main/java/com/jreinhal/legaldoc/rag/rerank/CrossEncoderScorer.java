package com.jreinhal.legaldoc.rag.rerank;

/**
 * Joint (query, passage) relevance capability. Higher is more relevant; implementations should
 * return values in [0,1] and must be deterministic for identical input. Errors are thrown, not
 * masked, so the reranker can fall back to the fused order.
 */
public interface CrossEncoderScorer {

    double score(String query, String passage);

    String name();
}
