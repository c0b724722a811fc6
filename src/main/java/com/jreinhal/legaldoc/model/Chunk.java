package com.jreinhal.legaldoc.model;

import com.jreinhal.legaldoc.util.VectorMath;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Atomic unit of retrieval and citation.
 *
 * <p>{@code termFrequencies} is the sparse representation used by the BM25 scorer,
 * {@code length} is the token count it was computed from. {@code embedding} may be null
 * when the document was indexed without a dense vector. The vector is copied in and out,
 * so a chunk held by an index snapshot never changes.</p>
 */
public record Chunk(String documentId, int chunkIndex, int pageNumber, String text, float[] embedding,
                    Map<String, Integer> termFrequencies, int length) {

    public Chunk {
        embedding = embedding == null ? null : embedding.clone();
        termFrequencies = termFrequencies == null ? Map.of() : Map.copyOf(termFrequencies);
    }

    @Override
    public float[] embedding() {
        return this.embedding == null ? null : this.embedding.clone();
    }

    public ChunkId id() {
        return new ChunkId(this.documentId, this.chunkIndex);
    }

    public int termFrequency(String term) {
        return this.termFrequencies.getOrDefault(term, 0);
    }

    public boolean hasEmbedding(int dimensions) {
        return this.embedding != null && this.embedding.length == dimensions;
    }

    /**
     * Cosine similarity to {@code query} without copying the stored vector. The caller checks
     * {@link #hasEmbedding(int)} first.
     */
    public double cosineSimilarity(float[] query) {
        return VectorMath.cosine(query, this.embedding);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk other)) {
            return false;
        }
        return this.chunkIndex == other.chunkIndex && this.pageNumber == other.pageNumber && this.length == other.length
                && Objects.equals(this.documentId, other.documentId) && Objects.equals(this.text, other.text)
                && Arrays.equals(this.embedding, other.embedding)
                && this.termFrequencies.equals(other.termFrequencies);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(this.documentId, this.chunkIndex, this.pageNumber, this.text, this.termFrequencies,
                this.length) + Arrays.hashCode(this.embedding);
    }

    @Override
    public String toString() {
        return "Chunk[" + this.documentId + "#" + this.chunkIndex + ", page " + this.pageNumber + ", "
                + (this.embedding == null ? "no embedding" : this.embedding.length + "-dim embedding") + "]";
    }
}
