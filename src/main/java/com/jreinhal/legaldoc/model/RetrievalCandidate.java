package com.jreinhal.legaldoc.model;

/**
 * A fused retrieval hit. Raw scores are kept alongside the normalized ones so the
 * tie-break on raw sparse score stays reproducible.
 */
public record RetrievalCandidate(Chunk chunk, double sparseScore, double denseScore, double normalizedSparse,
                                 double normalizedDense, double fusedScore, CandidateSource source, int fusedRank) {

    public ChunkId chunkId() {
        return this.chunk.id();
    }

    public RetrievalCandidate withFusedRank(int rank) {
        return new RetrievalCandidate(this.chunk, this.sparseScore, this.denseScore, this.normalizedSparse,
                this.normalizedDense, this.fusedScore, this.source, rank);
    }
}
