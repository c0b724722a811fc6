package com.jreinhal.legaldoc.model;

import java.util.Set;

/**
 * A term added to the query by graph expansion.
 *
 * @param term           the related concept, lower case
 * @param weight         1 / distance of the shortest path that reached it
 * @param distance       hop count from the originating entity's concept
 * @param relation       label of the last edge on the winning path
 * @param sourceEntities every entity whose traversal reached this term
 */
public record ExpansionTerm(String term, double weight, int distance, String relation, Set<String> sourceEntities) {

    public ExpansionTerm {
        sourceEntities = Set.copyOf(sourceEntities);
    }
}
