package com.jreinhal.legaldoc.dto;

import com.jreinhal.legaldoc.model.AnswerResult;
import com.jreinhal.legaldoc.model.Citation;
import java.util.List;

public record AskResponse(String answer,
                          List<Citation> citations,
                          String conversationId,
                          boolean grounded,
                          String outcome,
                          int generatorCalls,
                          String traceId) {

    public static AskResponse from(AnswerResult result) {
        return new AskResponse(result.answerText(), result.citations(), result.conversationId(), result.grounded(),
                result.outcome().name(), result.generatorCalls(), result.traceId());
    }
}
