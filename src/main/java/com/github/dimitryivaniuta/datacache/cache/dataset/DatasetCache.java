package com.github.dimitryivaniuta.datacache.cache.dataset;

import com.github.dimitryivaniuta.datacache.cache.chunk.ChunkSizer;
import com.github.dimitryivaniuta.datacache.cache.codec.RowCodec;
import com.github.dimitryivaniuta.datacache.cache.codec.RowCodecException;
import com.github.dimitryivaniuta.datacache.cache.metrics.DataCacheMetrics;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import com.github.dimitryivaniuta.datacache.cache.source.SourceReadException;
import com.github.dimitryivaniuta.datacache.cache.source.SourceReader;
import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreException;
import com.github.dimitryivaniuta.datacache.cache.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Stores a whole dataset as one hash entry ({@code <name>_data}), one field per chunk.
 *
 * <p>Populate writes into a private staging key first and renames it over the canonical key
 * once every chunk is in and the staging hash still holds all of them. Readers therefore see
 * no entry or a complete one, never a half-written one. The staging TTL is re-armed after each
 * chunk, so an aborted attempt cannot leave a non-expiring leftover.
 *
 * <p>Two processes populating the same name concurrently each write their own staging key;
 * the last rename wins as a whole. There is no distributed lock, so both still pay the source read.
 */
@Slf4j
@RequiredArgsConstructor
public class DatasetCache {

    private final KeyValueStore store;
    private final SourceReader source;
    private final ChunkSizer chunkSizer;
    private final RowCodec codec;
    private final Duration ttl;
    private final DataCacheMetrics metrics;

    /**
     * Replaces the cached entry of {@code name} with a fresh copy read from source.
     *
     * @return true if at least one chunk was written and the entry is now live
     */
    public boolean populate(String name) {
        final String key = DatasetKeys.entryKey(name);
        final String staging = DatasetKeys.stagingKey(name);
        final long start = System.nanoTime();
        boolean success = false;

        try {
            store.delete(key);

            int chunkSize = chunkSizer.computeChunkSize(name);
            final int[] written = {0};

            long totalRows = source.readChunks(name, chunkSize, chunk -> {
                store.hset(staging, DatasetKeys.chunkField(chunk.index()), codec.encode(chunk.rows()));
                store.expire(staging, ttl);
                written[0]++;
                log.debug("Staged {} chunk {} ({} rows)", name, chunk.index(), chunk.rows().size());
            });

            if (written[0] == 0) {
                log.error("Failed to cache {} data: source has no rows", name);
                return false;
            }

            // a staging key that expired between two chunks comes back holding only the later ones
            long staged = store.hlen(staging);
            if (staged != written[0]) {
                log.error("Failed to cache {} data: staging key holds {} of {} chunks", name, staged, written[0]);
                return false;
            }

            store.rename(staging, key);
            if (!store.expire(key, ttl)) {
                log.error("Failed to cache {} data: entry vanished before its TTL could be set", name);
                return false;
            }
            success = true;
            log.info("Successfully cached {} data (total {} rows, {} chunks of up to {} rows, ttl={}s)",
                    name, totalRows, written[0], chunkSize, ttl.toSeconds());
            return true;

        } catch (SourceReadException ex) {
            log.error("Failed to cache {} data: source read failed: {}", name, ex.getMessage());
            return false;
        } catch (CacheStoreException | RowCodecException ex) {
            log.error("Failed to cache {} data: {}", name, ex.getMessage());
            return false;
        } finally {
            if (!success) {
                discardStaging(staging);
            }
            metrics.datasetPopulate(name, success, System.nanoTime() - start);
        }
    }

    /**
     * Reassembles the cached dataset, chunks ordered by numeric index.
     *
     * @return empty if nothing is cached, or if the entry is unreadable (any bad chunk, a gap
     * in the indices, or a store failure); never a partial dataset
     */
    public Optional<List<Row>> load(String name) {
        final String key = DatasetKeys.entryKey(name);

        Map<String, String> fields;
        try {
            fields = store.hgetAll(key);
        } catch (CacheStoreException ex) {
            log.warn("Could not read cached {}: {}", name, ex.getMessage());
            metrics.datasetLoad(name, "failure");
            return Optional.empty();
        }

        if (fields.isEmpty()) {
            log.info("No cached chunks found for {}", name);
            metrics.datasetLoad(name, "miss");
            return Optional.empty();
        }

        try {
            TreeMap<Integer, String> ordered = new TreeMap<>();
            fields.forEach((field, payload) -> ordered.put(Integer.parseInt(field), payload));

            List<Row> rows = new ArrayList<>();
            int expected = 0;
            for (Map.Entry<Integer, String> e : ordered.entrySet()) {
                if (e.getKey() != expected++) {
                    throw new IllegalStateException("chunk " + (expected - 1) + " is missing");
                }
                rows.addAll(codec.decode(e.getValue()));
            }

            log.info("Loaded {} from cache ({} rows, {} chunks)", name, rows.size(), ordered.size());
            metrics.datasetLoad(name, "hit");
            return Optional.of(Collections.unmodifiableList(rows));

        } catch (NumberFormatException | IllegalStateException | RowCodecException ex) {
            log.warn("Discarding unreadable cache entry {}: {}", key, ex.getMessage());
            metrics.datasetLoad(name, "failure");
            return Optional.empty();
        }
    }

    /**
     * @return 1 if an entry was deleted, 0 if there was none (or the store could not be reached)
     */
    public long clear(String name) {
        try {
            boolean deleted = store.delete(DatasetKeys.entryKey(name));
            if (deleted) {
                log.info("Cleared cached {}", name);
            }
            return deleted ? 1 : 0;
        } catch (CacheStoreException ex) {
            log.warn("Could not clear cached {}: {}", name, ex.getMessage());
            return 0;
        }
    }

    public Optional<List<Row>> loadOrPopulate(String name) {
        Optional<List<Row>> cached = load(name);
        if (cached.isPresent()) {
            return cached;
        }

        log.info("Data not in cache, loading {} from source...", name);
        if (populate(name)) {
            return load(name);
        }
        log.error("Failed to load and cache {}", name);
        return Optional.empty();
    }

    private void discardStaging(String staging) {
        try {
            store.delete(staging);
        } catch (CacheStoreException ex) {
            log.warn("Could not delete staging key {}, it will expire on its own: {}", staging, ex.getMessage());
        }
    }
}
