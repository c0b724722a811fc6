package com.jreinhal.legaldoc.dto;

import java.util.List;

/**
 * A document that has already been split into chunks by the caller.
 *
 * @param documentId optional; derived from {@code filename} when absent
 */
public record IndexDocumentRequest(String documentId, String filename, List<ChunkEntry> chunks) {

    public record ChunkEntry(int pageNumber, String text) {
    }
}
