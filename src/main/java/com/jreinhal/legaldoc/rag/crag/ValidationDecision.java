package com.jreinhal.legaldoc.rag.crag;

import com.jreinhal.legaldoc.model.ValidationVerdict;
import java.util.List;

/**
 * @param feedback claims to steer the next generation away from; empty unless {@code outcome} is REGENERATED
 */
public record ValidationDecision(ValidationState state, CorrectiveOutcome outcome, ValidationVerdict verdict,
                                 List<String> feedback, String reason) {

    public ValidationDecision {
        feedback = List.copyOf(feedback);
    }

    public boolean isTerminal() {
        return this.outcome != CorrectiveOutcome.REGENERATED;
    }
}
