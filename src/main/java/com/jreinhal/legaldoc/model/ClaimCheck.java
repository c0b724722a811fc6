package com.jreinhal.legaldoc.model;

/**
 * @param bestPassageIndex citation index of the passage that supported the claim best, or 0 if none
 */
public record ClaimCheck(String claim, SupportLevel level, int bestPassageIndex, double score, String reason) {
}
