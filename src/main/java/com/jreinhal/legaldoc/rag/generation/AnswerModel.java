package com.jreinhal.legaldoc.rag.generation;

/**
 * Generative model capability. Implementations throw
 * {@link com.jreinhal.legaldoc.exception.PipelineStageException} with
 * {@code GENERATION_FAILURE} when no usable text can be produced.
 */
public interface AnswerModel {

    String complete(AnswerPrompt prompt);
}
