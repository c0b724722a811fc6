package com.jreinhal.legaldoc.rag.crag;

/**
 * Optional natural-language-inference capability used to settle partially supported claims.
 */
public interface EntailmentJudge {

    enum Entailment {
        /** The evidence states the claim. */
        ENTAILED,
        /** The evidence neither states nor contradicts the claim. */
        NEUTRAL,
        /** The evidence contradicts the claim. */
        CONTRADICTED
    }

    Entailment judge(String claim, String evidence);
}
