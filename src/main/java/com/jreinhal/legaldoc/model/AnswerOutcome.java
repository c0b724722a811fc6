package com.jreinhal.legaldoc.model;

public enum AnswerOutcome {
    ACCEPTED,
    SUPPRESSED,
    INSUFFICIENT_CONTEXT
}
