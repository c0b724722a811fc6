package com.jreinhal.legaldoc.rag.crag;

import com.jreinhal.legaldoc.model.SupportClass;

/**
 * States of the corrective validation state machine for a single draft.
 */
public enum ValidationState {
    /** A draft has been produced and awaits checking. */
    DRAFTED,
    /** Claims are being compared with the supplied passages. */
    CHECKING,
    /** Every checkable claim is supported. */
    SUPPORTED,
    /** Some claims are supported and some are not. */
    PARTIALLY_UNSUPPORTED,
    /** No claim is supported, or the check itself failed. */
    UNSUPPORTED;

    public static ValidationState of(SupportClass support) {
        return switch (support) {
            case SUPPORTED -> SUPPORTED;
            case PARTIALLY_SUPPORTED -> PARTIALLY_UNSUPPORTED;
            case UNSUPPORTED -> UNSUPPORTED;
        };
    }

    public boolean isTerminalCheck() {
        return this == SUPPORTED || this == PARTIALLY_UNSUPPORTED || this == UNSUPPORTED;
    }
}
