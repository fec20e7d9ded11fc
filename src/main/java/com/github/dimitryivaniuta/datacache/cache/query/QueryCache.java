package com.github.dimitryivaniuta.datacache.cache.query;

import com.github.dimitryivaniuta.datacache.cache.codec.RowCodec;
import com.github.dimitryivaniuta.datacache.cache.codec.RowCodecException;
import com.github.dimitryivaniuta.datacache.cache.metrics.CacheMetricsCounter;
import com.github.dimitryivaniuta.datacache.cache.metrics.DataCacheMetrics;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreException;
import com.github.dimitryivaniuta.datacache.cache.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Memoizes query results: one hash entry per {@link QueryKey} with a single {@code results} field.
 *
 * <p>Every lookup counts as exactly one hit or one miss. An unreadable payload or a store
 * failure is a miss; nothing from here reaches the caller except the computation's own exceptions.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryCache {

    public static final String RESULTS_FIELD = "results";

    private final KeyValueStore store;
    private final RowCodec codec;
    private final CacheMetricsCounter counter;
    private final Duration ttl;
    private final DataCacheMetrics metrics;

    public Optional<List<Row>> lookup(String dataset, String queryType, String queryValue) {
        QueryKey key = new QueryKey(dataset, queryType, queryValue);

        Optional<List<Row>> cached = read(key);
        if (cached.isPresent()) {
            countHit(key);
        } else {
            countMiss(key);
        }
        return cached;
    }

    /**
     * Writes the result and (re)arms the entry TTL. Does not touch hit/miss counters.
     *
     * @return false if the result could not be written
     */
    public boolean store(String dataset, String queryType, String queryValue, List<Row> result) {
        QueryKey key = new QueryKey(dataset, queryType, queryValue);
        try {
            store.hset(key.storeKey(), RESULTS_FIELD, codec.encode(result));
            store.expire(key.storeKey(), ttl);
            log.info("Cached result of {} ({} rows)", key.storeKey(), result.size());
            return true;
        } catch (CacheStoreException | RowCodecException ex) {
            log.warn("Could not cache result of {}: {}", key.storeKey(), ex.getMessage());
            return false;
        }
    }

    /**
     * Cached result if present, otherwise runs {@code compute} once and caches its result.
     * The computed result is returned even when caching it fails.
     */
    public List<Row> getOrCompute(String dataset, String queryType, String queryValue, QueryComputation compute) {
        Objects.requireNonNull(compute, "compute must not be null");

        Optional<List<Row>> cached = lookup(dataset, queryType, queryValue);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Row> computed = Objects.requireNonNull(compute.compute(), "compute returned null");
        store(dataset, queryType, queryValue, computed);
        return computed;
    }

    private Optional<List<Row>> read(QueryKey key) {
        try {
            Optional<String> payload = store.hget(key.storeKey(), RESULTS_FIELD);
            if (payload.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(List.copyOf(codec.decode(payload.get())));
        } catch (CacheStoreException | RowCodecException ex) {
            log.warn("Query cache read failed for {}, treating as miss: {}", key.storeKey(), ex.getMessage());
            return Optional.empty();
        }
    }

    private void countHit(QueryKey key) {
        metrics.queryHit(key.dataset(), key.queryType());
        try {
            counter.incrementHit();
        } catch (CacheStoreException ex) {
            log.warn("Could not record cache hit for {}: {}", key.storeKey(), ex.getMessage());
        }
    }

    private void countMiss(QueryKey key) {
        metrics.queryMiss(key.dataset(), key.queryType());
        try {
            counter.incrementMiss();
        } catch (CacheStoreException ex) {
            log.warn("Could not record cache miss for {}: {}", key.storeKey(), ex.getMessage());
        }
    }
}
