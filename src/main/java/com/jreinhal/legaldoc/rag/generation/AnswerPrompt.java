package com.jreinhal.legaldoc.rag.generation;

import com.jreinhal.legaldoc.model.ConversationTurn;
import java.util.List;

/**
 * Everything the answer model sees for one generation call.
 */
public record AnswerPrompt(String system, List<ConversationTurn> history, String user) {

    public AnswerPrompt {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
