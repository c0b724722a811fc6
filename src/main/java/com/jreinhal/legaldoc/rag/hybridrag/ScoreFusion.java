package com.jreinhal.legaldoc.rag.hybridrag;

import com.jreinhal.legaldoc.index.ScoredChunk;
import com.jreinhal.legaldoc.model.CandidateSource;
import com.jreinhal.legaldoc.model.Chunk;
import com.jreinhal.legaldoc.model.ChunkId;
import com.jreinhal.legaldoc.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear fusion of sparse and dense result sets.
 *
 * <p>Each set is min-max normalized over its own members, then
 * {@code fused = alpha * sparse + (1 - alpha) * dense}. A chunk absent from one set gets 0 for
 * that side. When every member of a set has the same raw score the whole set normalizes to 1.</p>
 *
 * <p>Order is fused score descending, raw sparse score descending, chunk id ascending.</p>
 */
public final class ScoreFusion {
    static final Comparator<RetrievalCandidate> FUSED_ORDER = Comparator
            .comparingDouble(RetrievalCandidate::fusedScore).reversed()
            .thenComparing(Comparator.comparingDouble(RetrievalCandidate::sparseScore).reversed())
            .thenComparing(RetrievalCandidate::chunkId);

    private ScoreFusion() {
    }

    public static List<RetrievalCandidate> fuse(List<ScoredChunk> sparse, List<ScoredChunk> dense, double alpha, int topK) {
        Map<ChunkId, Double> normSparse = normalize(sparse);
        Map<ChunkId, Double> normDense = normalize(dense);
        Map<ChunkId, Double> rawSparse = raw(sparse);
        Map<ChunkId, Double> rawDense = raw(dense);
        Map<ChunkId, Chunk> chunks = new LinkedHashMap<>();
        sparse.forEach(sc -> chunks.putIfAbsent(sc.chunk().id(), sc.chunk()));
        dense.forEach(sc -> chunks.putIfAbsent(sc.chunk().id(), sc.chunk()));

        List<RetrievalCandidate> fused = new ArrayList<>(chunks.size());
        for (Map.Entry<ChunkId, Chunk> entry : chunks.entrySet()) {
            ChunkId id = entry.getKey();
            boolean inSparse = normSparse.containsKey(id);
            boolean inDense = normDense.containsKey(id);
            double ns = normSparse.getOrDefault(id, 0.0);
            double nd = normDense.getOrDefault(id, 0.0);
            double score = alpha * ns + (1.0 - alpha) * nd;
            CandidateSource source = inSparse && inDense ? CandidateSource.BOTH
                    : inSparse ? CandidateSource.SPARSE_ONLY : CandidateSource.DENSE_ONLY;
            fused.add(new RetrievalCandidate(entry.getValue(), rawSparse.getOrDefault(id, 0.0),
                    rawDense.getOrDefault(id, 0.0), ns, nd, score, source, 0));
        }
        fused.sort(FUSED_ORDER);
        int limit = Math.min(Math.max(0, topK), fused.size());
        List<RetrievalCandidate> ranked = new ArrayList<>(limit);
        for (int i = 0; i < limit; ++i) {
            ranked.add(fused.get(i).withFusedRank(i + 1));
        }
        return ranked;
    }

    static Map<ChunkId, Double> normalize(List<ScoredChunk> results) {
        Map<ChunkId, Double> normalized = new HashMap<>();
        if (results.isEmpty()) {
            return normalized;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (ScoredChunk sc : results) {
            min = Math.min(min, sc.score());
            max = Math.max(max, sc.score());
        }
        double range = max - min;
        for (ScoredChunk sc : results) {
            double value = range > 0.0 ? (sc.score() - min) / range : 1.0;
            normalized.merge(sc.chunk().id(), value, Math::max);
        }
        return normalized;
    }

    private static Map<ChunkId, Double> raw(List<ScoredChunk> results) {
        Map<ChunkId, Double> raw = new HashMap<>();
        results.forEach(sc -> raw.merge(sc.chunk().id(), sc.score(), Math::max));
        return raw;
    }
}
