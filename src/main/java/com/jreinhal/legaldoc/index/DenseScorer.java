package com.jreinhal.legaldoc.index;

import com.jreinhal.legaldoc.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Exhaustive cosine similarity over the chunk embeddings of a snapshot.
 */
@Component
public class DenseScorer {

    public List<ScoredChunk> search(IndexSnapshot snapshot, float[] queryEmbedding, int limit) {
        if (snapshot.isEmpty() || queryEmbedding == null || queryEmbedding.length == 0 || limit <= 0) {
            return List.of();
        }
        List<ScoredChunk> scored = new ArrayList<>();
        for (Chunk chunk : snapshot.chunks()) {
            if (!chunk.hasEmbedding(queryEmbedding.length)) {
                continue;
            }
            scored.add(new ScoredChunk(chunk, chunk.cosineSimilarity(queryEmbedding)));
        }
        scored.sort(ScoredChunk.BY_SCORE);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }
}
