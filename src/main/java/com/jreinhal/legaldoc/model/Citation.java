package com.jreinhal.legaldoc.model;

public record Citation(String chunkId, String documentId, String filename, int pageNumber, String excerpt,
                       double relevanceScore) {
}
