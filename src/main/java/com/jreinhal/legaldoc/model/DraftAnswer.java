package com.jreinhal.legaldoc.model;

import java.util.List;
import java.util.Optional;

/**
 * @param citedIndexes distinct citation markers found in {@code text}, in order of first use;
 *                     always a subset of the indexes in {@code passages}
 * @param attempt      1-based count of generation calls made for the query so far
 */
public record DraftAnswer(String text, List<ContextPassage> passages, List<Integer> citedIndexes, int attempt,
                          boolean insufficientContext) {

    public DraftAnswer {
        passages = List.copyOf(passages);
        citedIndexes = List.copyOf(citedIndexes);
    }

    public Optional<ContextPassage> passage(int citationIndex) {
        return this.passages.stream().filter(p -> p.citationIndex() == citationIndex).findFirst();
    }

    public List<ContextPassage> citedPassages() {
        return this.citedIndexes.stream().map(this::passage).flatMap(Optional::stream).toList();
    }
}
