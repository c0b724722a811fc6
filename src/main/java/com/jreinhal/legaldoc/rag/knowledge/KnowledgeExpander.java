package com.jreinhal.legaldoc.rag.knowledge;

import com.jreinhal.legaldoc.model.ExpandedQuery;
import com.jreinhal.legaldoc.model.ExpansionTerm;
import com.jreinhal.legaldoc.model.ExtractedEntity;
import com.jreinhal.legaldoc.util.LogSanitizer;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Expands a query with concepts related to its entities in the {@link KnowledgeGraph}.
 *
 * <p>Each entity is mapped to the graph concepts it names, and the graph is walked breadth-first
 * from there. A term found at distance {@code d} gets weight {@code 1/d}. When several entities or
 * paths reach the same term it keeps the highest weight, not the sum, so terms common to many
 * entities are not pushed above the original query terms.</p>
 *
 * <p>Expansion never fails the query: missing entities, no graph match or any error yields the
 * unexpanded query.</p>
 */
@Service
public class KnowledgeExpander {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeExpander.class);
    private static final Comparator<ExpansionTerm> BY_WEIGHT = Comparator
            .comparingDouble(ExpansionTerm::weight).reversed()
            .thenComparing(ExpansionTerm::term);
    private final KnowledgeGraph graph;
    private final KnowledgeGraphProperties props;

    public KnowledgeExpander(KnowledgeGraph graph, KnowledgeGraphProperties props) {
        this.graph = graph;
        this.props = props;
    }

    public ExpandedQuery expand(String query, List<ExtractedEntity> entities) {
        List<ExtractedEntity> safeEntities = entities == null ? List.of() : entities;
        if (safeEntities.isEmpty() || !this.graph.isEnabled()) {
            return ExpandedQuery.unexpanded(query, safeEntities);
        }
        try {
            List<ExpansionTerm> terms = this.collectTerms(query, safeEntities);
            if (terms.isEmpty()) {
                if (log.isDebugEnabled()) {
                    log.debug("No graph match for {} entities of query {}", safeEntities.size(), LogSanitizer.querySummary(query));
                }
                return ExpandedQuery.unexpanded(query, safeEntities);
            }
            ExpandedQuery expanded = new ExpandedQuery(query, safeEntities, terms);
            if (log.isDebugEnabled()) {
                log.debug("Expanded query {} with {} terms: {}", LogSanitizer.querySummary(query), terms.size(), expanded.expansionSummary());
            }
            return expanded;
        } catch (RuntimeException e) {
            log.warn("Knowledge expansion failed for query {}; continuing unexpanded: {}", LogSanitizer.querySummary(query), e.getMessage());
            return ExpandedQuery.unexpanded(query, safeEntities);
        }
    }

    private List<ExpansionTerm> collectTerms(String query, List<ExtractedEntity> entities) {
        int maxDepth = Math.max(1, this.props.getMaxDepth());
        Map<String, ExpansionTerm> best = new LinkedHashMap<>();
        for (ExtractedEntity entity : entities) {
            for (String origin : this.originConcepts(entity)) {
                this.walk(origin, entity.text(), maxDepth, best);
            }
        }
        return best.values().stream()
                .filter(term -> !mentions(query, term.term()))
                .sorted(BY_WEIGHT)
                .limit(Math.max(0, this.props.getMaxExpansionTerms()))
                .toList();
    }

    private Set<String> originConcepts(ExtractedEntity entity) {
        Set<String> origins = new LinkedHashSet<>();
        String normalized = KnowledgeGraph.normalize(entity.text());
        if (this.graph.contains(normalized)) {
            origins.add(normalized);
        }
        origins.addAll(this.graph.conceptsIn(entity.text()));
        return origins;
    }

    private void walk(String origin, String entityText, int maxDepth, Map<String, ExpansionTerm> best) {
        Set<String> visited = new HashSet<>();
        visited.add(origin);
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(origin, 0));
        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            if (hop.distance() >= maxDepth) {
                continue;
            }
            for (KnowledgeGraph.Edge edge : this.graph.relationsOf(hop.concept())) {
                if (!visited.add(edge.target())) {
                    continue;
                }
                int distance = hop.distance() + 1;
                merge(best, edge.target(), distance, edge.relation(), entityText);
                queue.add(new Hop(edge.target(), distance));
            }
        }
    }

    private static void merge(Map<String, ExpansionTerm> best, String term, int distance, String relation, String entityText) {
        double weight = 1.0 / distance;
        ExpansionTerm existing = best.get(term);
        if (existing == null) {
            best.put(term, new ExpansionTerm(term, weight, distance, relation, Set.of(entityText)));
            return;
        }
        Set<String> sources = new LinkedHashSet<>(existing.sourceEntities());
        sources.add(entityText);
        if (weight > existing.weight()) {
            best.put(term, new ExpansionTerm(term, weight, distance, relation, sources));
        } else {
            best.put(term, new ExpansionTerm(term, existing.weight(), existing.distance(), existing.relation(), sources));
        }
    }

    private static boolean mentions(String query, String term) {
        return query != null && Pattern.compile("(?i)\\b" + Pattern.quote(term) + "\\b").matcher(query).find();
    }

    private record Hop(String concept, int distance) {
    }
}
