package com.jreinhal.legaldoc.rag.rerank;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.StageFailure;
import com.jreinhal.legaldoc.model.RerankedCandidate;
import com.jreinhal.legaldoc.model.RetrievalCandidate;
import com.jreinhal.legaldoc.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reorders the top of the fused candidate list with a {@link CrossEncoderScorer}.
 *
 * <p>Only the first {@code topM} candidates are scored; the rest are dropped. The output is
 * sorted by relevance descending with ties broken by fused rank, so identical input always gives
 * identical order. If any score cannot be computed the whole prefix keeps its fused order, with
 * the fused score standing in as relevance.</p>
 */
@Service
public class Reranker {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);
    static final Comparator<Scored> RELEVANCE_ORDER = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparingInt(s -> s.candidate().fusedRank());
    private final CrossEncoderScorer scorer;
    private final ExecutorService executor;
    @Value("${legaldoc.rerank.top-m:8}")
    private int topM;
    @Value("${legaldoc.retrieval.top-k:10}")
    private int topK;
    @Value("${legaldoc.rerank.min-score:0.0}")
    private double minScore;
    @Value("${legaldoc.rerank.timeout-ms:15000}")
    private long timeoutMs;
    @Value("${legaldoc.rerank.cache-size:2000}")
    private int cacheSize;
    @Value("${legaldoc.rerank.cache-ttl-seconds:900}")
    private long cacheTtlSeconds;
    private Cache<String, Double> scoreCache;

    public Reranker(CrossEncoderScorer scorer, @Qualifier("rerankerExecutor") ExecutorService executor) {
        this.scorer = scorer;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        if (this.topM > this.topK) {
            log.warn("legaldoc.rerank.top-m={} exceeds top-k={}; using {}", this.topM, this.topK, this.topK);
            this.topM = this.topK;
        }
        this.topM = Math.max(1, this.topM);
        if (this.cacheSize > 0 && this.cacheTtlSeconds > 0) {
            this.scoreCache = Caffeine.newBuilder()
                    .maximumSize(this.cacheSize)
                    .expireAfterWrite(Duration.ofSeconds(this.cacheTtlSeconds))
                    .build();
        }
        log.info("Reranker initialized (scorer={}, topM={}, minScore={}, cache={})",
                this.scorer.name(), this.topM, this.minScore, this.scoreCache != null);
    }

    public List<RerankedCandidate> rerank(String query, List<RetrievalCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<RetrievalCandidate> prefix = this.prefix(candidates);
        long startTime = System.currentTimeMillis();
        List<Scored> scored;
        try {
            scored = this.scoreAll(query, prefix);
        } catch (PipelineStageException e) {
            log.warn("Rerank failed for query {}; keeping fused order: {}", LogSanitizer.querySummary(query), e.getMessage());
            return this.fallback(candidates);
        }
        scored.sort(RELEVANCE_ORDER);
        List<RerankedCandidate> ranked = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            if (s.score() < this.minScore) {
                continue;
            }
            ranked.add(new RerankedCandidate(s.candidate(), s.score(), ranked.size() + 1, false));
        }
        if (log.isDebugEnabled()) {
            log.debug("Reranked {} of {} candidates with {} in {}ms ({} below min score)", prefix.size(), candidates.size(),
                    this.scorer.name(), System.currentTimeMillis() - startTime, scored.size() - ranked.size());
        }
        return ranked;
    }

    /**
     * Fused order over the same prefix, used when scoring is unavailable.
     */
    public List<RerankedCandidate> fallback(List<RetrievalCandidate> candidates) {
        List<RetrievalCandidate> prefix = new ArrayList<>(this.prefix(candidates));
        prefix.sort(Comparator.comparingInt(RetrievalCandidate::fusedRank));
        List<RerankedCandidate> ranked = new ArrayList<>(prefix.size());
        for (RetrievalCandidate candidate : prefix) {
            ranked.add(new RerankedCandidate(candidate, candidate.fusedScore(), ranked.size() + 1, true));
        }
        return ranked;
    }

    private List<RetrievalCandidate> prefix(List<RetrievalCandidate> candidates) {
        return candidates.size() > this.topM ? candidates.subList(0, this.topM) : candidates;
    }

    private List<Scored> scoreAll(String query, List<RetrievalCandidate> prefix) {
        List<Future<Double>> futures = new ArrayList<>(prefix.size());
        try {
            for (RetrievalCandidate candidate : prefix) {
                futures.add(this.executor.submit(() -> this.cachedScore(query, candidate)));
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new PipelineStageException(StageFailure.RERANK_FAILURE, "Reranker pool overloaded", e);
        }
        long deadline = System.currentTimeMillis() + this.timeoutMs;
        List<Scored> scored = new ArrayList<>(prefix.size());
        for (int i = 0; i < futures.size(); ++i) {
            Future<Double> future = futures.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.currentTimeMillis());
                scored.add(new Scored(prefix.get(i), future.get(remaining, TimeUnit.MILLISECONDS)));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new PipelineStageException(StageFailure.RERANK_FAILURE, "Reranking interrupted", e);
            } catch (TimeoutException e) {
                futures.forEach(f -> f.cancel(true));
                throw new PipelineStageException(StageFailure.RERANK_FAILURE, "Scoring timed out after " + this.timeoutMs + "ms", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new PipelineStageException(StageFailure.RERANK_FAILURE, "Scorer " + this.scorer.name() + " failed: " + cause.getMessage(), cause);
            }
        }
        return scored;
    }

    private double cachedScore(String query, RetrievalCandidate candidate) {
        String text = candidate.chunk().text();
        String key = this.scorer.name() + "|" + query + "|" + candidate.chunkId() + "|" + text.hashCode();
        if (this.scoreCache != null) {
            Double cached = this.scoreCache.getIfPresent(key);
            if (cached != null) {
                return cached;
            }
        }
        double score = this.scorer.score(query, text);
        if (Double.isNaN(score)) {
            throw new IllegalStateException("Scorer returned NaN for " + candidate.chunkId());
        }
        if (this.scoreCache != null) {
            this.scoreCache.put(key, score);
        }
        return score;
    }

    record Scored(RetrievalCandidate candidate, double score) {
    }
}
