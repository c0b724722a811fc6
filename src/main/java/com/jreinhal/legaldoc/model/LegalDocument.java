package com.jreinhal.legaldoc.model;

import java.time.Instant;
import java.util.List;

public record LegalDocument(String id, String filename, List<Chunk> chunks, int chunkCount, Instant indexedAt) {

    public LegalDocument {
        chunks = List.copyOf(chunks);
    }

    public static LegalDocument of(String id, String filename, List<Chunk> chunks) {
        return new LegalDocument(id, filename, chunks, chunks.size(), Instant.now());
    }
}
