package com.jreinhal.legaldoc.index;

import java.util.List;
import java.util.Map;

/**
 * Lexical lookup over a snapshot.
 */
public interface SparseScorer {

    /**
     * @param weightedTerms query terms (already tokenized with the index tokenizer) and their weights
     * @param limit         maximum number of results
     * @return chunks with a positive score, best first
     */
    List<ScoredChunk> search(IndexSnapshot snapshot, Map<String, Double> weightedTerms, int limit);
}
