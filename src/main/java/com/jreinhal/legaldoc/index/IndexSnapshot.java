package com.jreinhal.legaldoc.index;

import com.jreinhal.legaldoc.model.Chunk;
import com.jreinhal.legaldoc.model.LegalDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One immutable version of the corpus: documents, their chunks in id order, and the corpus
 * statistics the sparse scorer needs. Writers never touch an existing snapshot; they build a
 * new one and publish it through {@link ChunkIndex}.
 */
public final class IndexSnapshot {
    private static final IndexSnapshot EMPTY = new IndexSnapshot(0L, Map.of());

    private final long version;
    private final Map<String, LegalDocument> documents;
    private final List<Chunk> chunks;
    private final Map<String, Integer> documentFrequency;
    private final double averageChunkLength;

    private IndexSnapshot(long version, Map<String, LegalDocument> documents) {
        this.version = version;
        this.documents = Collections.unmodifiableMap(new TreeMap<>(documents));
        List<Chunk> allChunks = new ArrayList<>();
        Map<String, Integer> df = new HashMap<>();
        long totalLength = 0L;
        for (LegalDocument document : this.documents.values()) {
            for (Chunk chunk : document.chunks()) {
                allChunks.add(chunk);
                totalLength += chunk.length();
                for (String term : chunk.termFrequencies().keySet()) {
                    df.merge(term, 1, Integer::sum);
                }
            }
        }
        this.chunks = List.copyOf(allChunks);
        this.documentFrequency = Map.copyOf(df);
        this.averageChunkLength = allChunks.isEmpty() ? 0.0 : (double) totalLength / allChunks.size();
    }

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    IndexSnapshot withDocument(LegalDocument document) {
        Map<String, LegalDocument> next = new HashMap<>(this.documents);
        next.put(document.id(), document);
        return new IndexSnapshot(this.version + 1, next);
    }

    IndexSnapshot withoutDocument(String documentId) {
        Map<String, LegalDocument> next = new HashMap<>(this.documents);
        next.remove(documentId);
        return new IndexSnapshot(this.version + 1, next);
    }

    IndexSnapshot cleared() {
        return new IndexSnapshot(this.version + 1, Map.of());
    }

    public long version() {
        return this.version;
    }

    public Map<String, LegalDocument> documents() {
        return this.documents;
    }

    public List<Chunk> chunks() {
        return this.chunks;
    }

    public int chunkCount() {
        return this.chunks.size();
    }

    public boolean isEmpty() {
        return this.chunks.isEmpty();
    }

    public int documentFrequency(String term) {
        return this.documentFrequency.getOrDefault(term, 0);
    }

    public double averageChunkLength() {
        return this.averageChunkLength;
    }
}
