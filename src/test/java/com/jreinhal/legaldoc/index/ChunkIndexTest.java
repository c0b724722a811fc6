package com.jreinhal.legaldoc.index;

import static com.jreinhal.legaldoc.LegalDocFixtures.chunk;
import static com.jreinhal.legaldoc.LegalDocFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.legaldoc.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChunkIndexTest {

    private final ChunkIndex index = new ChunkIndex();

    @Test
    @DisplayName("A snapshot taken before indexing does not see the new document; a later read does")
    void snapshotIsolation() {
        IndexSnapshot before = this.index.snapshot();

        this.index.put(document("doc-a", "a.pdf", chunk("doc-a", 0, 1, "Parliament enacts laws")));

        assertThat(before.isEmpty()).isTrue();
        assertThat(before.documents()).isEmpty();
        IndexSnapshot after = this.index.snapshot();
        assertThat(after.chunkCount()).isEqualTo(1);
        assertThat(after.version()).isGreaterThan(before.version());
    }

    @Test
    @DisplayName("Re-indexing an id replaces its chunks instead of adding to them")
    void reUploadReplacesChunks() {
        this.index.put(document("doc-a", "a.pdf",
                chunk("doc-a", 0, 1, "old text one"), chunk("doc-a", 1, 2, "old text two")));
        this.index.put(document("doc-a", "a.pdf", chunk("doc-a", 0, 1, "new text")));

        IndexSnapshot snapshot = this.index.snapshot();
        assertThat(snapshot.chunks()).extracting(Chunk::text).containsExactly("new text");
        assertThat(snapshot.documentFrequency("old")).isZero();
        assertThat(snapshot.documentFrequency("new")).isEqualTo(1);
    }

    @Test
    void removeReportsWhetherTheDocumentExisted() {
        this.index.put(document("doc-a", "a.pdf", chunk("doc-a", 0, 1, "text")));

        assertThat(this.index.remove("doc-b")).isFalse();
        assertThat(this.index.remove("doc-a")).isTrue();
        assertThat(this.index.snapshot().isEmpty()).isTrue();
    }

    @Test
    void chunksAreOrderedByDocumentIdThenIndex() {
        this.index.put(document("doc-b", "b.pdf", chunk("doc-b", 0, 1, "beta")));
        this.index.put(document("doc-a", "a.pdf", chunk("doc-a", 0, 1, "alpha zero"), chunk("doc-a", 1, 1, "alpha one")));

        assertThat(this.index.snapshot().chunks()).extracting(c -> c.id().toString())
                .containsExactly("doc-a#0", "doc-a#1", "doc-b#0");
    }

    @Test
    void corpusStatisticsFollowTheChunks() {
        this.index.put(document("doc-a", "a.pdf",
                chunk("doc-a", 0, 1, "court court appeal"), chunk("doc-a", 1, 1, "court ruling")));

        IndexSnapshot snapshot = this.index.snapshot();
        assertThat(snapshot.documentFrequency("court")).isEqualTo(2);
        assertThat(snapshot.documentFrequency("appeal")).isEqualTo(1);
        assertThat(snapshot.averageChunkLength()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Concurrent writers never lose a document")
    void concurrentWritersAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String id = "doc-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return this.index.put(document(id, id + ".pdf", chunk(id, 0, 1, "section " + id)));
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(this.index.snapshot().documents()).hasSize(20);
        assertThat(this.index.snapshot().version()).isEqualTo(20L);
    }
}
