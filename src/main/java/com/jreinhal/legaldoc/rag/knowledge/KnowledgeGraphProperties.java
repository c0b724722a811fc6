package com.jreinhal.legaldoc.rag.knowledge;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "legaldoc.knowledge")
public class KnowledgeGraphProperties {
    /**
     * Master toggle for graph-driven query expansion.
     */
    private boolean enabled = true;

    /**
     * Maximum number of hops followed from an entity's concept.
     */
    private int maxDepth = 2;

    /**
     * Cap on expansion terms added to one query; the highest weighted terms are kept.
     */
    private int maxExpansionTerms = 12;

    /**
     * Concept graph. Example:
     * legaldoc.knowledge.concepts[0].name=constitution
     * legaldoc.knowledge.concepts[0].relations[0].relation=defines
     * legaldoc.knowledge.concepts[0].relations[0].target=fundamental rights
     */
    private List<Concept> concepts = new ArrayList<>();

    public boolean isEnabled() {
        return this.enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxDepth() {
        return this.maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxExpansionTerms() {
        return this.maxExpansionTerms;
    }

    public void setMaxExpansionTerms(int maxExpansionTerms) {
        this.maxExpansionTerms = maxExpansionTerms;
    }

    public List<Concept> getConcepts() {
        return this.concepts;
    }

    public void setConcepts(List<Concept> concepts) {
        this.concepts = concepts;
    }

    public static class Concept {
        private String name;
        private List<Relation> relations = new ArrayList<>();

        public Concept() {
        }

        public Concept(String name, List<Relation> relations) {
            this.name = name;
            this.relations = relations;
        }

        public String getName() {
            return this.name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<Relation> getRelations() {
            return this.relations;
        }

        public void setRelations(List<Relation> relations) {
            this.relations = relations;
        }
    }

    public static class Relation {
        private String relation;
        private String target;

        public Relation() {
        }

        public Relation(String relation, String target) {
            this.relation = relation;
            this.target = target;
        }

        public String getRelation() {
            return this.relation;
        }

        public void setRelation(String relation) {
            this.relation = relation;
        }

        public String getTarget() {
            return this.target;
        }

        public void setTarget(String target) {
            this.target = target;
        }
    }
}
