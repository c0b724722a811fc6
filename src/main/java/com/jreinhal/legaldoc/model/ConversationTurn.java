package com.jreinhal.legaldoc.model;

import java.time.Instant;
import java.util.List;

public record ConversationTurn(String query, String answer, List<Citation> citations, Instant timestamp) {

    public ConversationTurn {
        citations = List.copyOf(citations);
    }
}
