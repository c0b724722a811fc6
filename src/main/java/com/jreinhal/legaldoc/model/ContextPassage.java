package com.jreinhal.legaldoc.model;

/**
 * A passage handed to the answer model under a 1-based citation index.
 */
public record ContextPassage(int citationIndex, RerankedCandidate candidate) {

    public String text() {
        return this.candidate.chunk().text();
    }

    public int pageNumber() {
        return this.candidate.chunk().pageNumber();
    }
}
