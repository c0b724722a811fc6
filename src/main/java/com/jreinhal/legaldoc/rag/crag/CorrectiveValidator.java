package com.jreinhal.legaldoc.rag.crag;

import com.jreinhal.legaldoc.config.PipelineProperties;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.ValidationVerdict;
import com.jreinhal.legaldoc.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Corrective Validator
 *
 * Checks each draft answer against the passages it was generated from and decides what the
 * pipeline does with it. The decision is a small explicit state machine:
 *
 * DRAFTED -> CHECKING -> SUPPORTED | PARTIALLY_UNSUPPORTED | UNSUPPORTED
 *
 * and each checked state maps to one outcome:
 * 1. SUPPORTED: ACCEPTED
 * 2. PARTIALLY_UNSUPPORTED: REGENERATED with the unsupported claims as feedback while
 *    regenerations remain, otherwise SUPPRESSED
 * 3. UNSUPPORTED: REGENERATED at most once per query while regenerations remain, otherwise
 *    SUPPRESSED
 *
 * Regenerations are counted from the draft's attempt number, so the loop in the orchestrator
 * makes at most retry-budget + 1 generator calls. A checker failure is an UNSUPPORTED verdict.
 */
@Service
public class CorrectiveValidator {

    private static final Logger log = LoggerFactory.getLogger(CorrectiveValidator.class);

    private final ClaimSupportChecker checker;
    private final PipelineProperties pipelineProperties;

    public CorrectiveValidator(ClaimSupportChecker checker, PipelineProperties pipelineProperties) {
        this.checker = checker;
        this.pipelineProperties = pipelineProperties;
    }

    public ValidationSession newSession() {
        return new ValidationSession(this.pipelineProperties.getRetryBudget());
    }

    /**
     * Check a draft. Never throws: a checker failure yields {@link ValidationVerdict#failed(String)}.
     */
    public ValidationVerdict check(DraftAnswer draft) {
        try {
            return this.checker.check(draft);
        }
        catch (RuntimeException e) {
            log.warn("Claim check failed for draft attempt {}: {}", draft.attempt(),
                    LogSanitizer.sanitize(e.getMessage()));
            return ValidationVerdict.failed("claim check failed: " + e.getClass().getSimpleName());
        }
    }

    /**
     * Run the state machine for one checked draft.
     *
     * @param draft   the draft that was checked
     * @param verdict the verdict from {@link #check(DraftAnswer)}, or a failed verdict when the check timed out
     * @param session per-query loop state
     */
    public ValidationDecision decide(DraftAnswer draft, ValidationVerdict verdict, ValidationSession session) {
        session.restart();
        session.moveTo(ValidationState.CHECKING);
        ValidationState state = ValidationState.of(verdict.support());
        session.moveTo(state);

        if (draft.insufficientContext()) {
            return this.finish(session, state, CorrectiveOutcome.SUPPRESSED, verdict,
                    "draft reports insufficient context");
        }
        int regenerations = draft.attempt() - 1;
        boolean budgetLeft = regenerations < session.retryBudget();
        return switch (state) {
            case SUPPORTED -> this.finish(session, state, CorrectiveOutcome.ACCEPTED, verdict,
                    "all claims supported");
            case PARTIALLY_UNSUPPORTED -> budgetLeft
                    ? this.regenerate(session, state, verdict, "unsupported claims: " + verdict.flaggedSpans().size())
                    : this.finish(session, state, CorrectiveOutcome.SUPPRESSED, verdict, "retry budget exhausted");
            case UNSUPPORTED -> {
                if (!budgetLeft) {
                    yield this.finish(session, state, CorrectiveOutcome.SUPPRESSED, verdict, "retry budget exhausted");
                }
                if (session.isUnsupportedRegenerationUsed()) {
                    yield this.finish(session, state, CorrectiveOutcome.SUPPRESSED, verdict,
                            "unsupported again after regeneration");
                }
                session.markUnsupportedRegeneration();
                yield this.regenerate(session, state, verdict, "no claim supported");
            }
            default -> throw new IllegalStateException("Unexpected validation state " + state);
        };
    }

    private ValidationDecision regenerate(ValidationSession session, ValidationState state,
                                          ValidationVerdict verdict, String reason) {
        // a failed check carries its reason in flaggedSpans, which is not feedback for the model
        List<String> feedback = verdict.claims().isEmpty() ? List.of() : verdict.flaggedSpans();
        return this.finish(session, state, CorrectiveOutcome.REGENERATED, verdict, reason, feedback);
    }

    private ValidationDecision finish(ValidationSession session, ValidationState state, CorrectiveOutcome outcome,
                                      ValidationVerdict verdict, String reason) {
        return this.finish(session, state, outcome, verdict, reason, List.of());
    }

    private ValidationDecision finish(ValidationSession session, ValidationState state, CorrectiveOutcome outcome,
                                      ValidationVerdict verdict, String reason, List<String> feedback) {
        if (log.isDebugEnabled()) {
            log.debug("Validation {} -> {} ({}), transitions={}", state, outcome, reason, session.transitions());
        }
        return new ValidationDecision(state, outcome, verdict, feedback, reason);
    }
}
