package com.jreinhal.legaldoc.model;

import java.util.List;

/**
 * Result of one {@code answer} call. {@code grounded} is true only for {@link AnswerOutcome#ACCEPTED}.
 */
public record AnswerResult(String answerText, List<Citation> citations, String conversationId, boolean grounded,
                           AnswerOutcome outcome, int generatorCalls, String traceId) {

    public AnswerResult {
        citations = List.copyOf(citations);
    }
}
