package com.github.dimitryivaniuta.datacache.cache.metrics;

import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreException;
import com.github.dimitryivaniuta.datacache.cache.store.KeyValueStore;

import java.util.Objects;

/**
 * Query cache hit/miss totals kept in the store itself, so every process sharing the store
 * accumulates into the same two counters (INCR is atomic). No reset: the counters live as
 * long as the store's data does.
 */
public class CacheMetricsCounter {

    public static final String HITS_KEY = "cache:hits";
    public static final String MISSES_KEY = "cache:misses";

    private final KeyValueStore store;

    public CacheMetricsCounter(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public long incrementHit() {
        return store.incr(HITS_KEY);
    }

    public long incrementMiss() {
        return store.incr(MISSES_KEY);
    }

    public CacheMetricsSnapshot snapshot() {
        return new CacheMetricsSnapshot(read(HITS_KEY), read(MISSES_KEY));
    }

    private long read(String key) {
        String raw = store.get(key).orElse(null);
        if (raw == null) return 0L;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new CacheStoreException("Counter " + key + " holds a non-numeric value: " + raw, e);
        }
    }
}
