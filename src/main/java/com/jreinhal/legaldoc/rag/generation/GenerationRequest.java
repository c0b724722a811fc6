package com.jreinhal.legaldoc.rag.generation;

import com.jreinhal.legaldoc.model.ConversationTurn;
import com.jreinhal.legaldoc.model.RerankedCandidate;
import java.util.List;

/**
 * @param feedback         claim spans the validator flagged in the previous draft; empty on the first attempt
 * @param previousAttempts generation calls already made for this query
 */
public record GenerationRequest(String query, List<ConversationTurn> history, List<RerankedCandidate> ranked,
                                List<String> feedback, int previousAttempts) {

    public GenerationRequest {
        history = history == null ? List.of() : List.copyOf(history);
        ranked = List.copyOf(ranked);
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    public static GenerationRequest first(String query, List<ConversationTurn> history, List<RerankedCandidate> ranked) {
        return new GenerationRequest(query, history, ranked, List.of(), 0);
    }

    public GenerationRequest retry(List<String> newFeedback, int attemptsSoFar) {
        return new GenerationRequest(this.query, this.history, this.ranked, newFeedback, attemptsSoFar);
    }
}
