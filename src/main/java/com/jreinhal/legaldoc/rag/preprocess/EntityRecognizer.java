package com.jreinhal.legaldoc.rag.preprocess;

import com.jreinhal.legaldoc.model.ExtractedEntity;
import java.util.List;

/**
 * Named-entity capability consumed by the query preprocessing stage.
 * Implementations may throw; the orchestrator degrades to the unexpanded query.
 */
public interface EntityRecognizer {

    List<ExtractedEntity> extract(String text);
}
