package com.jreinhal.legaldoc.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> RETRIEVAL = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "which", "tell", "me", "about",
            "describe", "explain", "find", "show", "give", "also", "does",
            "do", "did", "it", "its", "this", "that", "these", "those",
            "can", "could", "would", "should", "there", "their", "i", "my"
    );

    public static final Set<String> RERANKER = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with", "does", "do", "me", "tell"
    );

    public static final Set<String> CLAIM_CHECK = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "and", "but", "or",
            "nor", "for", "so", "as", "if", "when", "where", "what", "which",
            "who", "whom", "whose", "why", "how", "that", "this", "these",
            "those", "then", "than", "in", "on", "at", "by", "with", "about",
            "into", "through", "to", "from", "of", "it", "its", "they", "them",
            "their", "also", "such", "any", "all", "each", "under", "according",
            "source", "sources", "document", "documents", "states", "provides"
    );

    private StopWords() {
    }
}
