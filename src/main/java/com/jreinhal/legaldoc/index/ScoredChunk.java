package com.jreinhal.legaldoc.index;

import com.jreinhal.legaldoc.model.Chunk;
import java.util.Comparator;

/**
 * Raw score of one chunk from a single lookup method.
 */
public record ScoredChunk(Chunk chunk, double score) {
    /** Score descending, then chunk id ascending. */
    public static final Comparator<ScoredChunk> BY_SCORE = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(sc -> sc.chunk().id());
}
