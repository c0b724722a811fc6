package com.jreinhal.legaldoc.rag.preprocess;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.legaldoc.model.EntityType;
import com.jreinhal.legaldoc.model.ExtractedEntity;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraph;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraphProperties;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraphProperties.Concept;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraphProperties.Relation;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PatternEntityRecognizerTest {
    private PatternEntityRecognizer recognizer;

    @BeforeEach
    void setUp() {
        KnowledgeGraphProperties props = new KnowledgeGraphProperties();
        props.setConcepts(List.of(new Concept("due process", List.of(new Relation("requires", "fair hearing")))));
        KnowledgeGraph graph = new KnowledgeGraph(props);
        graph.init();
        this.recognizer = new PatternEntityRecognizer(graph);
    }

    @Nested
    @DisplayName("Statutes")
    class StatuteTest {
        @Test
        void articleWithSubClause() {
            assertThat(recognizer.extract("What does Article 21(1) say?"))
                    .contains(new ExtractedEntity("Article 21(1)", EntityType.STATUTE));
        }

        @Test
        void numberedAmendment() {
            assertThat(recognizer.extract("Which rights does the Fourteenth Amendment protect?"))
                    .contains(new ExtractedEntity("Fourteenth Amendment", EntityType.STATUTE));
        }

        @Test
        @DisplayName("Repeated references are reported once")
        void deduplicates() {
            List<ExtractedEntity> entities = recognizer.extract("Article 21 and article 21 again");
            assertThat(entities).filteredOn(e -> e.type() == EntityType.STATUTE).hasSize(1);
        }
    }

    @Test
    @DisplayName("Case names drop the leading question word")
    void caseCitation() {
        assertThat(this.recognizer.extract("Is Roe v. Wade still good law?"))
                .contains(new ExtractedEntity("Roe v. Wade", EntityType.CASE_CITATION));
    }

    @Test
    void court() {
        assertThat(this.recognizer.extract("Can the Supreme Court strike down a law?"))
                .contains(new ExtractedEntity("Supreme Court", EntityType.COURT));
    }

    @Test
    @DisplayName("Knowledge graph concepts keep the surface text of the query")
    void graphConcept() {
        assertThat(this.recognizer.extract("Explain Due Process in criminal trials"))
                .contains(new ExtractedEntity("Due Process", EntityType.LEGAL_CONCEPT));
    }

    @Test
    void entitiesAreInTextOrder() {
        assertThat(this.recognizer.extract("Does Article 14 apply before the Supreme Court?"))
                .extracting(ExtractedEntity::text)
                .containsSubsequence("Article 14", "Supreme Court");
    }

    @Test
    void blankInput() {
        assertThat(this.recognizer.extract("  ")).isEmpty();
        assertThat(this.recognizer.extract(null)).isEmpty();
    }
}
