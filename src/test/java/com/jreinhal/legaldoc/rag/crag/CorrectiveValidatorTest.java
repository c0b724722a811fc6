package com.jreinhal.legaldoc.rag.crag;

import static com.jreinhal.legaldoc.rag.crag.ClaimSupportCheckerTest.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.legaldoc.config.PipelineProperties;
import com.jreinhal.legaldoc.model.ClaimCheck;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.SupportClass;
import com.jreinhal.legaldoc.model.SupportLevel;
import com.jreinhal.legaldoc.model.ValidationVerdict;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CorrectiveValidatorTest {
    private static final ClaimCheck GOOD = new ClaimCheck("Article 21 protects life.", SupportLevel.EXACT, 1, 0.9, "coverage");
    private static final ClaimCheck BAD = new ClaimCheck("Article 21 grants free legal aid.", SupportLevel.NONE, 1, 0.2, "coverage");
    private static final ValidationVerdict SUPPORTED = new ValidationVerdict(SupportClass.SUPPORTED, List.of(GOOD), List.of(), 0.9);
    private static final ValidationVerdict PARTIAL = new ValidationVerdict(SupportClass.PARTIALLY_SUPPORTED,
            List.of(GOOD, BAD), List.of(BAD.claim()), 0.55);
    private static final ValidationVerdict UNSUPPORTED = new ValidationVerdict(SupportClass.UNSUPPORTED,
            List.of(BAD), List.of(BAD.claim()), 0.2);

    private ClaimSupportChecker checker;
    private PipelineProperties pipelineProperties;
    private CorrectiveValidator validator;

    @BeforeEach
    void setUp() {
        this.checker = mock(ClaimSupportChecker.class);
        this.pipelineProperties = new PipelineProperties();
        this.pipelineProperties.setRetryBudget(2);
        this.validator = new CorrectiveValidator(this.checker, this.pipelineProperties);
    }

    @Test
    @DisplayName("Supported draft is accepted on the first attempt")
    void acceptsSupported() {
        ValidationSession session = this.validator.newSession();

        ValidationDecision decision = this.validator.decide(draft("text", 1), SUPPORTED, session);

        assertThat(decision.outcome()).isEqualTo(CorrectiveOutcome.ACCEPTED);
        assertThat(decision.state()).isEqualTo(ValidationState.SUPPORTED);
        assertThat(decision.isTerminal()).isTrue();
        assertThat(session.transitions()).containsExactly("DRAFTED->CHECKING", "CHECKING->SUPPORTED");
    }

    @Test
    @DisplayName("Partially unsupported draft is regenerated once, then the supported one is accepted")
    void regenerateThenAccept() {
        ValidationSession session = this.validator.newSession();

        ValidationDecision first = this.validator.decide(draft("text", 1), PARTIAL, session);
        ValidationDecision second = this.validator.decide(draft("text", 2), SUPPORTED, session);

        assertThat(first.outcome()).isEqualTo(CorrectiveOutcome.REGENERATED);
        assertThat(first.state()).isEqualTo(ValidationState.PARTIALLY_UNSUPPORTED);
        assertThat(first.feedback()).containsExactly(BAD.claim());
        assertThat(second.outcome()).isEqualTo(CorrectiveOutcome.ACCEPTED);
        assertThat(session.transitions()).contains("PARTIALLY_UNSUPPORTED->DRAFTED", "CHECKING->SUPPORTED")
                .hasSize(5);
    }

    @Test
    @DisplayName("Claims still unsupported after the retry budget suppress the answer")
    void budgetExhausted() {
        ValidationSession session = this.validator.newSession();

        assertThat(this.validator.decide(draft("text", 1), PARTIAL, session).outcome()).isEqualTo(CorrectiveOutcome.REGENERATED);
        assertThat(this.validator.decide(draft("text", 2), PARTIAL, session).outcome()).isEqualTo(CorrectiveOutcome.REGENERATED);
        ValidationDecision last = this.validator.decide(draft("text", 3), PARTIAL, session);

        assertThat(last.outcome()).isEqualTo(CorrectiveOutcome.SUPPRESSED);
        assertThat(last.feedback()).isEmpty();
        assertThat(session.maxGeneratorCalls()).isEqualTo(3);
    }

    @Nested
    @DisplayName("Unsupported drafts")
    class UnsupportedTest {
        @Test
        @DisplayName("Are regenerated at most once per query")
        void regeneratedOnce() {
            ValidationSession session = validator.newSession();

            ValidationDecision first = validator.decide(draft("text", 1), UNSUPPORTED, session);
            ValidationDecision second = validator.decide(draft("text", 2), UNSUPPORTED, session);

            assertThat(first.outcome()).isEqualTo(CorrectiveOutcome.REGENERATED);
            assertThat(second.outcome()).isEqualTo(CorrectiveOutcome.SUPPRESSED);
        }

        @Test
        void suppressedWithoutBudget() {
            pipelineProperties.setRetryBudget(0);
            ValidationSession session = validator.newSession();

            assertThat(validator.decide(draft("text", 1), UNSUPPORTED, session).outcome())
                    .isEqualTo(CorrectiveOutcome.SUPPRESSED);
            assertThat(session.maxGeneratorCalls()).isEqualTo(1);
        }
    }

    @Test
    void insufficientContextIsSuppressed() {
        DraftAnswer empty = new DraftAnswer("I don't have enough context to answer this question.", List.of(), List.of(), 1, true);

        ValidationDecision decision = this.validator.decide(empty, UNSUPPORTED, this.validator.newSession());

        assertThat(decision.outcome()).isEqualTo(CorrectiveOutcome.SUPPRESSED);
    }

    @Test
    @DisplayName("A checker error becomes an unsupported verdict with no model feedback")
    void checkerFailure() {
        when(this.checker.check(any())).thenThrow(new IllegalStateException("tokenizer exploded"));
        DraftAnswer draft = draft("text", 1);

        ValidationVerdict verdict = this.validator.check(draft);
        ValidationDecision decision = this.validator.decide(draft, verdict, this.validator.newSession());

        assertThat(verdict.support()).isEqualTo(SupportClass.UNSUPPORTED);
        assertThat(verdict.flaggedSpans()).singleElement().asString().contains("IllegalStateException");
        assertThat(decision.outcome()).isEqualTo(CorrectiveOutcome.REGENERATED);
        assertThat(decision.feedback()).isEmpty();
    }

    @Nested
    @DisplayName("Generation failures")
    class GenerationFailureTest {
        @Test
        void secondConsecutiveFailureEndsTheLoop() {
            ValidationSession session = new ValidationSession(2);

            assertThat(session.allowRetryAfterGenerationFailure(1)).isTrue();
            assertThat(session.allowRetryAfterGenerationFailure(2)).isFalse();
        }

        @Test
        void failureOnTheLastAllowedCallIsNotRetried() {
            ValidationSession session = new ValidationSession(2);

            assertThat(session.allowRetryAfterGenerationFailure(1)).isTrue();
            session.recordGenerationSuccess();
            assertThat(session.allowRetryAfterGenerationFailure(3)).isFalse();
        }

        @Test
        void failureWithCallsLeftAfterSuccess() {
            ValidationSession session = new ValidationSession(2);
            session.recordGenerationSuccess();

            assertThat(session.allowRetryAfterGenerationFailure(2)).isTrue();
        }
    }
}
