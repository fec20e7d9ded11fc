package com.github.dimitryivaniuta.datacache.cache.model;

import java.util.List;

/**
 * A contiguous slice of a dataset's rows, in source order. Indices start at 0.
 */
public record Chunk(int index, List<Row> rows) {

    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        rows = List.copyOf(rows);
    }
}
