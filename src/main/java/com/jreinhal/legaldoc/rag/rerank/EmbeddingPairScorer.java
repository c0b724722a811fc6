package com.jreinhal.legaldoc.rag.rerank;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.legaldoc.rag.embedding.TextEmbedder;
import com.jreinhal.legaldoc.util.VectorMath;
import java.time.Duration;

/**
 * Scores a pair by embedding the query alone and the query joined with the passage, and mapping
 * the cosine of the two vectors from [-1,1] to [0,1]. Works with an instruction-tuned embedding
 * model served next to the chat model, so no separate cross-encoder deployment is needed.
 */
public class EmbeddingPairScorer implements CrossEncoderScorer {
    private static final int MAX_PASSAGE_CHARS = 1000;
    private final TextEmbedder embedder;
    private final Cache<String, float[]> queryEmbeddings = Caffeine.newBuilder()
            .maximumSize(256)
            .expireAfterWrite(Duration.ofMinutes(10))
            .build();

    public EmbeddingPairScorer(TextEmbedder embedder) {
        this.embedder = embedder;
    }

    @Override
    public double score(String query, String passage) {
        float[] queryVector = this.queryEmbeddings.get(query, q -> this.embedder.embed("query: " + q));
        String content = passage == null ? "" : passage;
        if (content.length() > MAX_PASSAGE_CHARS) {
            content = content.substring(0, MAX_PASSAGE_CHARS) + "...";
        }
        float[] pairVector = this.embedder.embed("query: " + query + "\ndocument: " + content);
        if (pairVector.length != queryVector.length) {
            throw new IllegalStateException("Embedding dimension mismatch: query=" + queryVector.length + ", pair=" + pairVector.length);
        }
        double cosine = VectorMath.cosine(queryVector, pairVector);
        return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
    }

    @Override
    public String name() {
        return "dedicated";
    }
}
