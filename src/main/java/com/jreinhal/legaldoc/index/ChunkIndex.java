package com.jreinhal.legaldoc.index;

import com.jreinhal.legaldoc.model.LegalDocument;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the current {@link IndexSnapshot}. Reads are lock-free and see one complete version;
 * writes are serialized and publish a new version atomically, so an index mutation is visible
 * to every retrieval that starts after the write method returns.
 */
@Component
public class ChunkIndex {
    private static final Logger log = LoggerFactory.getLogger(ChunkIndex.class);
    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();

    public IndexSnapshot snapshot() {
        return this.current.get();
    }

    /**
     * Installs a document, replacing any earlier version with the same id.
     */
    public IndexSnapshot put(LegalDocument document) {
        this.writeLock.lock();
        try {
            IndexSnapshot next = this.current.get().withDocument(document);
            this.current.set(next);
            log.info("Indexed document {} ({} chunks), snapshot v{} holds {} chunks",
                    document.id(), document.chunkCount(), next.version(), next.chunkCount());
            return next;
        } finally {
            this.writeLock.unlock();
        }
    }

    public boolean remove(String documentId) {
        this.writeLock.lock();
        try {
            IndexSnapshot snapshot = this.current.get();
            if (!snapshot.documents().containsKey(documentId)) {
                return false;
            }
            IndexSnapshot next = snapshot.withoutDocument(documentId);
            this.current.set(next);
            log.info("Removed document {}, snapshot v{} holds {} chunks", documentId, next.version(), next.chunkCount());
            return true;
        } finally {
            this.writeLock.unlock();
        }
    }

    public void clear() {
        this.writeLock.lock();
        try {
            this.current.set(this.current.get().cleared());
        } finally {
            this.writeLock.unlock();
        }
    }
}
