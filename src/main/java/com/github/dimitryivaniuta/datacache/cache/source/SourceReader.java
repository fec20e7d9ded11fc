package com.github.dimitryivaniuta.datacache.cache.source;

import com.github.dimitryivaniuta.datacache.cache.model.Chunk;

import java.util.function.Consumer;

/**
 * Slow primary source of the known datasets.
 */
public interface SourceReader {

    /**
     * Total data rows of the dataset (header excluded). May cost a full scan.
     *
     * @throws SourceReadException unknown dataset, missing or unreadable source
     */
    long countRows(String name);

    /**
     * Streams the dataset in source order as consecutive chunks of {@code chunkSize} rows
     * (the last one may be shorter), indexed from 0. Exceptions thrown by the consumer
     * propagate unchanged and stop the read.
     *
     * @return number of rows read
     * @throws SourceReadException unknown dataset, missing source or malformed row
     */
    long readChunks(String name, int chunkSize, Consumer<Chunk> consumer);
}
