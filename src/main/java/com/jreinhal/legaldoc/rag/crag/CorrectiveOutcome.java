package com.jreinhal.legaldoc.rag.crag;

public enum CorrectiveOutcome {
    /** Return the draft as-is. */
    ACCEPTED,
    /** Generate again with the flagged claims as negative feedback. */
    REGENERATED,
    /** Withhold the draft and answer with the low-confidence disclosure. */
    SUPPRESSED
}
