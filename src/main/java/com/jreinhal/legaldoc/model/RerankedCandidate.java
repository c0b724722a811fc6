package com.jreinhal.legaldoc.model;

/**
 * @param fallback true when the scorer failed and {@code relevanceScore} is the fused score
 */
public record RerankedCandidate(RetrievalCandidate candidate, double relevanceScore, int rank, boolean fallback) {

    public Chunk chunk() {
        return this.candidate.chunk();
    }

    public ChunkId chunkId() {
        return this.candidate.chunkId();
    }
}
