package com.jreinhal.legaldoc.service;

import com.jreinhal.legaldoc.exception.DocumentIndexingException;
import com.jreinhal.legaldoc.index.ChunkIndex;
import com.jreinhal.legaldoc.index.IndexSnapshot;
import com.jreinhal.legaldoc.model.Chunk;
import com.jreinhal.legaldoc.model.LegalDocument;
import com.jreinhal.legaldoc.rag.embedding.TextEmbedder;
import com.jreinhal.legaldoc.util.TextTokenizer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Installs pre-chunked documents into the {@link ChunkIndex}.
 *
 * Embeddings are computed before the index write lock is taken, so a slow embedding model never
 * blocks other writers, and a failed embedding leaves the index exactly as it was. The method
 * returns after the new snapshot is published.
 */
@Service
public class DocumentIndexingService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIndexingService.class);
    private static final Pattern DOCUMENT_ID = Pattern.compile("[A-Za-z0-9_.-]{1,128}");
    private static final int DOCUMENT_ID_LENGTH = 12;
    private final ChunkIndex chunkIndex;
    private final TextEmbedder textEmbedder;

    public DocumentIndexingService(ChunkIndex chunkIndex, TextEmbedder textEmbedder) {
        this.chunkIndex = chunkIndex;
        this.textEmbedder = textEmbedder;
    }

    public record ChunkInput(int pageNumber, String text) {
    }

    public record DocumentSummary(String id, String filename, int chunkCount, Instant indexedAt) {
    }

    /**
     * Index a document, replacing any earlier version with the same id.
     *
     * @throws IllegalArgumentException  when the id or filename is invalid or no chunk has text
     * @throws DocumentIndexingException when embedding fails
     */
    public LegalDocument indexDocument(String documentId, String filename, List<ChunkInput> chunks) {
        if (!StringUtils.hasText(filename)) {
            throw new IllegalArgumentException("filename is required");
        }
        String id = StringUtils.hasText(documentId) ? documentId.trim() : generateDocumentId(filename);
        if (!DOCUMENT_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("documentId must match " + DOCUMENT_ID.pattern());
        }
        List<ChunkInput> usable = chunks == null ? List.of() : chunks.stream()
                .filter(c -> c != null && StringUtils.hasText(c.text()))
                .toList();
        if (usable.isEmpty()) {
            throw new IllegalArgumentException("Document " + id + " has no chunks with text");
        }
        if (usable.size() < chunks.size()) {
            log.warn("Skipped {} blank chunks in document {}", chunks.size() - usable.size(), id);
        }
        long start = System.currentTimeMillis();
        List<float[]> embeddings;
        try {
            embeddings = this.textEmbedder.embedAll(usable.stream().map(ChunkInput::text).toList());
        }
        catch (RuntimeException e) {
            throw new DocumentIndexingException("Embedding failed for document " + id, e);
        }
        if (embeddings.size() != usable.size()) {
            throw new DocumentIndexingException("Embedding model returned " + embeddings.size()
                    + " vectors for " + usable.size() + " chunks of document " + id, null);
        }
        List<Chunk> built = new ArrayList<>(usable.size());
        for (int i = 0; i < usable.size(); ++i) {
            ChunkInput input = usable.get(i);
            List<String> terms = TextTokenizer.terms(input.text());
            built.add(new Chunk(id, i, Math.max(1, input.pageNumber()), input.text(), embeddings.get(i),
                    TextTokenizer.termFrequencies(terms), terms.size()));
        }
        LegalDocument document = LegalDocument.of(id, filename.trim(), built);
        IndexSnapshot published = this.chunkIndex.put(document);
        if (log.isDebugEnabled()) {
            log.debug("Document {} indexed in {}ms (snapshot v{})", id, System.currentTimeMillis() - start,
                    published.version());
        }
        return document;
    }

    public List<DocumentSummary> listDocuments() {
        return this.chunkIndex.snapshot().documents().values().stream()
                .map(d -> new DocumentSummary(d.id(), d.filename(), d.chunkCount(), d.indexedAt()))
                .toList();
    }

    public boolean removeDocument(String documentId) {
        if (!StringUtils.hasText(documentId)) {
            return false;
        }
        return this.chunkIndex.remove(documentId);
    }

    /**
     * Stable id derived from the filename: the first 12 hex characters of its MD5 digest.
     */
    public static String generateDocumentId(String filename) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hashed = digest.digest(filename.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed).toLowerCase(Locale.ROOT).substring(0, DOCUMENT_ID_LENGTH);
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
