package com.github.dimitryivaniuta.datacache.cache.chunk;

import com.github.dimitryivaniuta.datacache.cache.source.SourceReader;

import java.util.Objects;

/**
 * Picks the per-chunk row count so a dataset splits into roughly {@code targetChunkCount} chunks.
 */
public class ChunkSizer {

    private final SourceReader source;
    private final int targetChunkCount;

    public ChunkSizer(SourceReader source, int targetChunkCount) {
        if (targetChunkCount <= 0) {
            throw new IllegalArgumentException("targetChunkCount must be > 0, got " + targetChunkCount);
        }
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.targetChunkCount = targetChunkCount;
    }

    /**
     * @throws com.github.dimitryivaniuta.datacache.cache.source.SourceReadException if the source cannot be scanned
     */
    public int computeChunkSize(String name) {
        return chunkSizeFor(source.countRows(name), targetChunkCount);
    }

    public int targetChunkCount() {
        return targetChunkCount;
    }

    // max(1, ...) : fewer rows than the target must still give a usable chunk size
    static int chunkSizeFor(long totalRows, int targetChunkCount) {
        long size = Math.max(1L, totalRows / targetChunkCount);
        return (int) Math.min(size, Integer.MAX_VALUE);
    }
}
