package com.jreinhal.legaldoc.config;

import com.jreinhal.legaldoc.rag.crag.EntailmentJudge;
import com.jreinhal.legaldoc.rag.crag.LlmEntailmentJudge;
import com.jreinhal.legaldoc.rag.embedding.TextEmbedder;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraph;
import com.jreinhal.legaldoc.rag.preprocess.EntityRecognizer;
import com.jreinhal.legaldoc.rag.preprocess.LlmEntityRecognizer;
import com.jreinhal.legaldoc.rag.preprocess.PatternEntityRecognizer;
import com.jreinhal.legaldoc.rag.rerank.CrossEncoderScorer;
import com.jreinhal.legaldoc.rag.rerank.EmbeddingPairScorer;
import com.jreinhal.legaldoc.rag.rerank.KeywordOverlapScorer;
import com.jreinhal.legaldoc.rag.rerank.LlmRelevanceScorer;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses one adapter per model-driven capability.
 *
 * <ul>
 *   <li>{@code legaldoc.models.entity-recognizer}: pattern (default) or llm</li>
 *   <li>{@code legaldoc.models.reranker}: dedicated (default), llm or keyword</li>
 *   <li>{@code legaldoc.validation.llm-entailment-enabled}: adds the entailment judge</li>
 * </ul>
 */
@Configuration
public class ModelAdapterConfig {
    private static final Logger log = LoggerFactory.getLogger(ModelAdapterConfig.class);

    @Bean
    public EntityRecognizer entityRecognizer(
            @Value(value = "${legaldoc.models.entity-recognizer:pattern}") String kind,
            KnowledgeGraph knowledgeGraph, ChatClient.Builder chatClientBuilder) {
        PatternEntityRecognizer patterns = new PatternEntityRecognizer(knowledgeGraph);
        String normalized = kind.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "pattern":
                log.info("Entity recognizer: pattern");
                return patterns;
            case "llm":
                log.info("Entity recognizer: llm (merged with pattern results)");
                return new LlmEntityRecognizer(chatClientBuilder.build(), patterns);
            default:
                throw new IllegalStateException("Unknown legaldoc.models.entity-recognizer: " + kind);
        }
    }

    @Bean
    public CrossEncoderScorer crossEncoderScorer(
            @Value(value = "${legaldoc.models.reranker:dedicated}") String kind,
            TextEmbedder textEmbedder, ChatClient.Builder chatClientBuilder) {
        String normalized = kind.trim().toLowerCase(Locale.ROOT);
        CrossEncoderScorer scorer = switch (normalized) {
            case "dedicated" -> new EmbeddingPairScorer(textEmbedder);
            case "llm" -> new LlmRelevanceScorer(chatClientBuilder.build());
            case "keyword" -> new KeywordOverlapScorer();
            default -> throw new IllegalStateException("Unknown legaldoc.models.reranker: " + kind);
        };
        log.info("Rerank scorer: {}", scorer.name());
        return scorer;
    }

    @Bean
    @ConditionalOnProperty(name = "legaldoc.validation.llm-entailment-enabled", havingValue = "true")
    public EntailmentJudge entailmentJudge(ChatClient.Builder chatClientBuilder) {
        log.info("Entailment judge enabled for partially supported claims");
        return new LlmEntailmentJudge(chatClientBuilder.build());
    }
}
