package com.jreinhal.legaldoc.rag.hybridrag;

import com.jreinhal.legaldoc.index.ChunkIndex;
import com.jreinhal.legaldoc.index.DenseScorer;
import com.jreinhal.legaldoc.index.IndexSnapshot;
import com.jreinhal.legaldoc.index.ScoredChunk;
import com.jreinhal.legaldoc.index.SparseScorer;
import com.jreinhal.legaldoc.model.ExpandedQuery;
import com.jreinhal.legaldoc.model.ExpansionTerm;
import com.jreinhal.legaldoc.model.RetrievalCandidate;
import com.jreinhal.legaldoc.rag.embedding.TextEmbedder;
import com.jreinhal.legaldoc.util.LogSanitizer;
import com.jreinhal.legaldoc.util.TextTokenizer;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Hybrid sparse and dense retrieval with min-max score fusion.
 *
 * <p>Both lookups read the same {@link IndexSnapshot} and run concurrently on the RAG pool. If one
 * of them fails or times out it contributes an empty result set and the other is still fused.</p>
 */
@Service
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);
    private final ChunkIndex chunkIndex;
    private final SparseScorer sparseScorer;
    private final DenseScorer denseScorer;
    private final TextEmbedder textEmbedder;
    private final ExecutorService ragExecutor;
    @Value("${legaldoc.retrieval.top-k:10}")
    private int topK;
    @Value("${legaldoc.retrieval.pool-size:30}")
    private int poolSize;
    @Value("${legaldoc.retrieval.alpha:0.4}")
    private double alpha;
    @Value("${legaldoc.retrieval.expansion-weight:0.5}")
    private double expansionWeight;
    @Value("${legaldoc.retrieval.dense-include-expansions:false}")
    private boolean denseIncludeExpansions;
    @Value("${legaldoc.retrieval.lookup-timeout-ms:8000}")
    private long lookupTimeoutMs;

    public HybridRetriever(ChunkIndex chunkIndex, SparseScorer sparseScorer, DenseScorer denseScorer,
                           TextEmbedder textEmbedder, @Qualifier("ragExecutor") ExecutorService ragExecutor) {
        this.chunkIndex = chunkIndex;
        this.sparseScorer = sparseScorer;
        this.denseScorer = denseScorer;
        this.textEmbedder = textEmbedder;
        this.ragExecutor = ragExecutor;
    }

    @PostConstruct
    public void init() {
        if (this.alpha < 0.0 || this.alpha > 1.0) {
            log.warn("legaldoc.retrieval.alpha={} outside [0,1]; clamping", this.alpha);
            this.alpha = Math.max(0.0, Math.min(1.0, this.alpha));
        }
        this.topK = Math.max(1, this.topK);
        if (this.poolSize <= this.topK) {
            log.warn("legaldoc.retrieval.pool-size={} must exceed top-k={}; using {}", this.poolSize, this.topK, this.topK * 2);
            this.poolSize = this.topK * 2;
        }
        if (this.expansionWeight >= 1.0 || this.expansionWeight < 0.0) {
            log.warn("legaldoc.retrieval.expansion-weight={} must be in [0,1); using 0.5", this.expansionWeight);
            this.expansionWeight = 0.5;
        }
        log.info("Hybrid retriever initialized (topK={}, poolSize={}, alpha={}, expansionWeight={})",
                this.topK, this.poolSize, this.alpha, this.expansionWeight);
    }

    public HybridRetrievalResult retrieve(ExpandedQuery query) {
        long startTime = System.currentTimeMillis();
        IndexSnapshot snapshot = this.chunkIndex.snapshot();
        if (snapshot.isEmpty()) {
            return new HybridRetrievalResult(List.of(), Map.of("snapshotVersion", snapshot.version(), "mode", "empty-index"));
        }
        Map<String, Double> weightedTerms = this.weightedTerms(query);
        CompletableFuture<List<ScoredChunk>> sparseFuture = this.submit("sparse",
                () -> this.sparseScorer.search(snapshot, weightedTerms, this.poolSize));
        CompletableFuture<List<ScoredChunk>> denseFuture = this.submit("dense",
                () -> this.denseScorer.search(snapshot, this.textEmbedder.embed(this.denseText(query)), this.poolSize));

        long deadline = startTime + this.lookupTimeoutMs;
        LookupOutcome sparse = this.await("sparse", sparseFuture, deadline);
        LookupOutcome dense = this.await("dense", denseFuture, deadline);

        List<RetrievalCandidate> candidates = ScoreFusion.fuse(sparse.results(), dense.results(), this.alpha, this.topK);
        long elapsed = System.currentTimeMillis() - startTime;
        if (log.isInfoEnabled()) {
            log.info("HybridRetriever: query {} sparse={} dense={} fused={} (snapshot v{}) in {}ms",
                    LogSanitizer.querySummary(query.originalQuery()), sparse.results().size(), dense.results().size(),
                    candidates.size(), snapshot.version(), elapsed);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("snapshotVersion", snapshot.version());
        metadata.put("sparseHits", sparse.results().size());
        metadata.put("denseHits", dense.results().size());
        metadata.put("sparseDegraded", sparse.degraded());
        metadata.put("denseDegraded", dense.degraded());
        metadata.put("queryTerms", weightedTerms.size());
        metadata.put("elapsedMs", elapsed);
        return new HybridRetrievalResult(candidates, metadata);
    }

    /**
     * Original query terms weigh 1.0; an expansion term's tokens weigh
     * {@code expansionWeight * term weight}, and a token keeps the larger of the two if it is both.
     */
    Map<String, Double> weightedTerms(ExpandedQuery query) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String term : TextTokenizer.terms(query.originalQuery())) {
            weights.put(term, 1.0);
        }
        for (ExpansionTerm expansion : query.expansions()) {
            double weight = this.expansionWeight * expansion.weight();
            for (String term : TextTokenizer.terms(expansion.term())) {
                weights.merge(term, weight, Math::max);
            }
        }
        return weights;
    }

    private String denseText(ExpandedQuery query) {
        if (!this.denseIncludeExpansions || !query.isExpanded()) {
            return query.originalQuery();
        }
        return query.originalQuery() + " " + query.expansions().stream()
                .map(ExpansionTerm::term)
                .collect(Collectors.joining(" "));
    }

    private CompletableFuture<List<ScoredChunk>> submit(String lookup, Supplier<List<ScoredChunk>> task) {
        try {
            return CompletableFuture.supplyAsync(task, this.ragExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("RAG thread pool overloaded; skipping {} lookup: {}", lookup, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private LookupOutcome await(String lookup, CompletableFuture<List<ScoredChunk>> future, long deadline) {
        long remainingMs = deadline - System.currentTimeMillis();
        try {
            if (remainingMs <= 0L && !future.isDone()) {
                throw new TimeoutException("deadline passed");
            }
            return new LookupOutcome(future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS), false);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("HybridRetriever {} lookup interrupted", lookup);
            return new LookupOutcome(List.of(), true);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("HybridRetriever {} lookup timed out after {}ms", lookup, this.lookupTimeoutMs);
            return new LookupOutcome(List.of(), true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("HybridRetriever {} lookup failed: {}", lookup, cause.getMessage());
            return new LookupOutcome(List.of(), true);
        }
    }

    public record HybridRetrievalResult(List<RetrievalCandidate> candidates, Map<String, Object> metadata) {
        public boolean isEmpty() {
            return this.candidates.isEmpty();
        }
    }

    private record LookupOutcome(List<ScoredChunk> results, boolean degraded) {
    }
}
