package com.jreinhal.legaldoc.rag.knowledge;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Directed concept graph with labelled edges, built once from {@link KnowledgeGraphProperties}.
 * Concept names are compared case-insensitively.
 */
@Component
public class KnowledgeGraph {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);
    private final KnowledgeGraphProperties props;
    private volatile Map<String, List<Edge>> edges = Map.of();
    private volatile List<ConceptMatcher> matchers = List.of();

    public KnowledgeGraph(KnowledgeGraphProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void init() {
        Map<String, List<Edge>> adjacency = new LinkedHashMap<>();
        for (KnowledgeGraphProperties.Concept concept : this.props.getConcepts()) {
            String name = normalize(concept.getName());
            if (name.isEmpty()) {
                continue;
            }
            List<Edge> out = adjacency.computeIfAbsent(name, k -> new ArrayList<>());
            if (concept.getRelations() == null) {
                continue;
            }
            for (KnowledgeGraphProperties.Relation relation : concept.getRelations()) {
                String target = normalize(relation.getTarget());
                if (target.isEmpty() || target.equals(name)) {
                    continue;
                }
                String label = relation.getRelation() == null || relation.getRelation().isBlank()
                        ? "related-to" : relation.getRelation().trim();
                out.add(new Edge(label, target));
            }
        }
        adjacency.replaceAll((k, v) -> List.copyOf(v));
        this.edges = Map.copyOf(adjacency);
        // longest names first so "due process" wins over "process"
        this.matchers = adjacency.keySet().stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(ConceptMatcher::of)
                .toList();
        int edgeCount = this.edges.values().stream().mapToInt(List::size).sum();
        log.info("Knowledge graph loaded: {} concepts, {} relations", this.edges.size(), edgeCount);
    }

    public boolean isEnabled() {
        return this.props.isEnabled() && !this.edges.isEmpty();
    }

    public List<Edge> relationsOf(String concept) {
        return this.edges.getOrDefault(normalize(concept), List.of());
    }

    public boolean contains(String concept) {
        return this.edges.containsKey(normalize(concept));
    }

    public Set<String> concepts() {
        return this.edges.keySet();
    }

    /**
     * Concepts named in {@code text} as whole words, longest names first.
     */
    public List<String> conceptsIn(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (ConceptMatcher matcher : this.matchers) {
            if (matcher.pattern().matcher(text).find()) {
                found.add(matcher.concept());
            }
        }
        return found;
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public record Edge(String relation, String target) {
    }

    private record ConceptMatcher(String concept, Pattern pattern) {
        static ConceptMatcher of(String concept) {
            return new ConceptMatcher(concept, Pattern.compile("(?i)\\b" + Pattern.quote(concept) + "\\b"));
        }
    }
}
