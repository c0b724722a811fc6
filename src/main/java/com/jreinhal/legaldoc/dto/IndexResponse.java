package com.jreinhal.legaldoc.dto;

import java.time.Instant;

public record IndexResponse(String documentId, String filename, int chunkCount, Instant indexedAt) {
}
