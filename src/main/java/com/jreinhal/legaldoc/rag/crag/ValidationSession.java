package com.jreinhal.legaldoc.rag.crag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-query bookkeeping for the corrective loop. Not shared between queries or threads.
 */
public final class ValidationSession {
    private final int retryBudget;
    private final List<String> transitions = new ArrayList<>();
    private ValidationState state = ValidationState.DRAFTED;
    private boolean unsupportedRegenerationUsed;
    private boolean lastGenerationFailed;

    public ValidationSession(int retryBudget) {
        this.retryBudget = Math.max(0, retryBudget);
    }

    public int retryBudget() {
        return this.retryBudget;
    }

    /** Total generator calls this query may make. */
    public int maxGeneratorCalls() {
        return this.retryBudget + 1;
    }

    public ValidationState state() {
        return this.state;
    }

    void moveTo(ValidationState next) {
        this.transitions.add(this.state + "->" + next);
        this.state = next;
    }

    /** A new draft restarts the per-draft states. */
    void restart() {
        if (this.state != ValidationState.DRAFTED) {
            this.moveTo(ValidationState.DRAFTED);
        }
    }

    boolean isUnsupportedRegenerationUsed() {
        return this.unsupportedRegenerationUsed;
    }

    void markUnsupportedRegeneration() {
        this.unsupportedRegenerationUsed = true;
    }

    /**
     * Record a failed generator call and decide whether another call is allowed. Failed calls count
     * against the same budget as regenerations, and two failures in a row end the loop.
     *
     * @param callsSoFar generator calls made so far, including the failed one
     */
    public boolean allowRetryAfterGenerationFailure(int callsSoFar) {
        boolean allowed = !this.lastGenerationFailed && callsSoFar < this.maxGeneratorCalls();
        this.lastGenerationFailed = true;
        this.transitions.add("generation-failure#" + callsSoFar + (allowed ? "->retry" : "->suppressed"));
        return allowed;
    }

    public void recordGenerationSuccess() {
        this.lastGenerationFailed = false;
    }

    public List<String> transitions() {
        return Collections.unmodifiableList(this.transitions);
    }
}
