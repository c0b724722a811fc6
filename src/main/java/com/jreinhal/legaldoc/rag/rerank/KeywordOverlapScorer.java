package com.jreinhal.legaldoc.rag.rerank;

import com.jreinhal.legaldoc.constant.StopWords;
import com.jreinhal.legaldoc.util.TextTokenizer;
import java.util.HashSet;
import java.util.Set;

/**
 * Fraction of the query's content terms that occur in the passage. Needs no model.
 */
public class KeywordOverlapScorer implements CrossEncoderScorer {

    @Override
    public double score(String query, String passage) {
        Set<String> queryTerms = new HashSet<>(TextTokenizer.terms(query, StopWords.RERANKER));
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> passageTerms = new HashSet<>(TextTokenizer.terms(passage, StopWords.RERANKER));
        long matched = queryTerms.stream().filter(passageTerms::contains).count();
        return (double) matched / queryTerms.size();
    }

    @Override
    public String name() {
        return "keyword";
    }
}
