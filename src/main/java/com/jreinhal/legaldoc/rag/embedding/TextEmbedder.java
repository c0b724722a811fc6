package com.jreinhal.legaldoc.rag.embedding;

import java.util.List;

/**
 * Dense embedding capability. Implementations must return vectors of one fixed dimension.
 */
public interface TextEmbedder {

    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }
}
