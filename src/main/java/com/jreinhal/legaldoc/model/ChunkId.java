package com.jreinhal.legaldoc.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a chunk within the corpus. Ordered by document id, then chunk index.
 */
public record ChunkId(String documentId, int chunkIndex) implements Comparable<ChunkId> {
    private static final Comparator<ChunkId> ORDER = Comparator.comparing(ChunkId::documentId)
            .thenComparingInt(ChunkId::chunkIndex);

    public ChunkId {
        Objects.requireNonNull(documentId, "documentId");
    }

    @Override
    public int compareTo(ChunkId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return this.documentId + "#" + this.chunkIndex;
    }
}
