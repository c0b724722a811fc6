package com.jreinhal.legaldoc.rag.embedding;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link TextEmbedder} backed by the configured Spring AI {@link EmbeddingModel}.
 */
@Component
public class SpringAiTextEmbedder implements TextEmbedder {
    private static final Logger log = LoggerFactory.getLogger(SpringAiTextEmbedder.class);
    private final EmbeddingModel embeddingModel;
    @Value("${legaldoc.embedding.batch-size:32}")
    private int batchSize = 32;

    public SpringAiTextEmbedder(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = this.embeddingModel.embed(text == null ? "" : text);
        if (vector == null || vector.length == 0) {
            throw new IllegalStateException("Embedding model returned an empty vector");
        }
        return vector;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        int step = Math.max(1, this.batchSize);
        for (int i = 0; i < texts.size(); i += step) {
            List<String> batch = texts.subList(i, Math.min(i + step, texts.size()));
            List<float[]> embedded = this.embeddingModel.embed(batch);
            if (embedded == null || embedded.size() != batch.size()) {
                throw new IllegalStateException("Embedding model returned " + (embedded == null ? 0 : embedded.size())
                        + " vectors for a batch of " + batch.size());
            }
            vectors.addAll(embedded);
        }
        if (log.isDebugEnabled()) {
            log.debug("Embedded {} texts in batches of {}", texts.size(), step);
        }
        return vectors;
    }
}
