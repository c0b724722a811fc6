package com.jreinhal.legaldoc.index;

import com.jreinhal.legaldoc.model.Chunk;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Okapi BM25 with a non-negative idf, {@code ln(1 + (N - n + 0.5) / (n + 0.5))}, so that a
 * term present in most chunks still adds a little instead of subtracting.
 */
@Component
public class Bm25SparseScorer implements SparseScorer {
    private static final Logger log = LoggerFactory.getLogger(Bm25SparseScorer.class);
    @Value("${legaldoc.retrieval.bm25.k1:1.5}")
    private double k1 = 1.5;
    @Value("${legaldoc.retrieval.bm25.b:0.75}")
    private double b = 0.75;

    @PostConstruct
    public void init() {
        log.info("BM25 sparse scorer initialized (k1={}, b={})", this.k1, this.b);
    }

    @Override
    public List<ScoredChunk> search(IndexSnapshot snapshot, Map<String, Double> weightedTerms, int limit) {
        if (snapshot.isEmpty() || weightedTerms.isEmpty() || limit <= 0) {
            return List.of();
        }
        int n = snapshot.chunkCount();
        double avgLength = Math.max(1.0, snapshot.averageChunkLength());
        List<ScoredChunk> scored = new ArrayList<>();
        for (Chunk chunk : snapshot.chunks()) {
            double score = 0.0;
            for (Map.Entry<String, Double> term : weightedTerms.entrySet()) {
                int tf = chunk.termFrequency(term.getKey());
                if (tf == 0) {
                    continue;
                }
                int df = snapshot.documentFrequency(term.getKey());
                double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
                double norm = tf * (this.k1 + 1.0) / (tf + this.k1 * (1.0 - this.b + this.b * chunk.length() / avgLength));
                score += term.getValue() * idf * norm;
            }
            if (score > 0.0) {
                scored.add(new ScoredChunk(chunk, score));
            }
        }
        scored.sort(ScoredChunk.BY_SCORE);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }
}
