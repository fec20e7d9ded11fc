package com.github.dimitryivaniuta.datacache.cache.query;

import com.github.dimitryivaniuta.datacache.cache.model.Row;

import java.util.List;

/**
 * The expensive part of a query, run only on a cache miss.
 */
@FunctionalInterface
public interface QueryComputation {

    List<Row> compute();
}
