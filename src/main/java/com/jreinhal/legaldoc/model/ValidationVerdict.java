package com.jreinhal.legaldoc.model;

import java.util.List;

public record ValidationVerdict(SupportClass support, List<ClaimCheck> claims, List<String> flaggedSpans,
                                double confidence) {

    public ValidationVerdict {
        claims = List.copyOf(claims);
        flaggedSpans = List.copyOf(flaggedSpans);
    }

    /**
     * Verdict used when the checker itself failed. Never counts as grounded.
     */
    public static ValidationVerdict failed(String reason) {
        return new ValidationVerdict(SupportClass.UNSUPPORTED, List.of(), List.of(reason), 0.0);
    }
}
