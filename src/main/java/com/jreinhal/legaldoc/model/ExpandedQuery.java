package com.jreinhal.legaldoc.model;

import java.util.List;
import java.util.stream.Collectors;

public record ExpandedQuery(String originalQuery, List<ExtractedEntity> entities, List<ExpansionTerm> expansions) {

    public ExpandedQuery {
        entities = List.copyOf(entities);
        expansions = List.copyOf(expansions);
    }

    public static ExpandedQuery unexpanded(String query) {
        return new ExpandedQuery(query, List.of(), List.of());
    }

    public static ExpandedQuery unexpanded(String query, List<ExtractedEntity> entities) {
        return new ExpandedQuery(query, entities, List.of());
    }

    public boolean isExpanded() {
        return !this.expansions.isEmpty();
    }

    public String expansionSummary() {
        return this.expansions.stream()
                .map(e -> e.term() + "(" + String.format("%.2f", e.weight()) + ")")
                .collect(Collectors.joining(", "));
    }
}
