package com.github.dimitryivaniuta.datacache.cache;

import com.github.dimitryivaniuta.datacache.cache.chunk.ChunkSizer;
import com.github.dimitryivaniuta.datacache.cache.codec.RowCodec;
import com.github.dimitryivaniuta.datacache.cache.dataset.DatasetCache;
import com.github.dimitryivaniuta.datacache.cache.metrics.CacheMetricsCounter;
import com.github.dimitryivaniuta.datacache.cache.metrics.CacheMetricsSnapshot;
import com.github.dimitryivaniuta.datacache.cache.metrics.DataCacheMetrics;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import com.github.dimitryivaniuta.datacache.cache.query.QueryCache;
import com.github.dimitryivaniuta.datacache.cache.query.QueryComputation;
import com.github.dimitryivaniuta.datacache.cache.source.SourceReader;
import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreException;
import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreUnavailableException;
import com.github.dimitryivaniuta.datacache.cache.store.KeyValueStore;
import io.github.resilience4j.retry.MaxRetriesExceededException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the cache layer: "dataset by name, load or populate" and
 * "query result, get or compute".
 *
 * <p>The store must answer PING while this is constructed (retried {@code connectAttempts}
 * times). If it does not, construction fails with {@link CacheStoreUnavailableException}, which
 * is the only error of this layer meant to stop the process. Everything else falls back to
 * the source or to recomputation.
 */
@Slf4j
public class CacheFacade {

    private final DatasetCache datasetCache;
    private final QueryCache queryCache;
    private final CacheMetricsCounter metricsCounter;
    private final Set<String> knownDatasets;
    private final Duration ttl;
    private final int targetChunkCount;

    public CacheFacade(KeyValueStore store,
                       SourceReader source,
                       RowCodec codec,
                       DataCacheMetrics metrics,
                       DataCacheProperties props) {
        verifyReachable(store, props.getConnectAttempts(), props.getConnectBackoff());

        this.ttl = props.getTtl();
        this.targetChunkCount = props.getTargetChunkCount();
        this.knownDatasets = Set.copyOf(props.getDatasets().keySet());

        ChunkSizer sizer = new ChunkSizer(source, targetChunkCount);
        this.metricsCounter = new CacheMetricsCounter(store);
        this.datasetCache = new DatasetCache(store, source, sizer, codec, ttl, metrics);
        this.queryCache = new QueryCache(store, codec, metricsCounter, ttl, metrics);

        log.info("Data cache ready (ttl={}s, targetChunkCount={}, datasets={})",
                ttl.toSeconds(), targetChunkCount, knownDatasets);
    }

    public Optional<List<Row>> dataset(String name) {
        return datasetCache.loadOrPopulate(name);
    }

    public List<Row> queryResult(String name, String queryType, String queryValue, QueryComputation compute) {
        return queryCache.getOrCompute(name, queryType, queryValue, compute);
    }

    /**
     * @return 1 if a cached entry was removed, 0 otherwise
     */
    public long clearDataset(String name) {
        return datasetCache.clear(name);
    }

    /**
     * Cumulative query cache hits/misses as recorded in the store (shared by all processes).
     *
     * @return empty if the counters cannot be read
     */
    public Optional<CacheMetricsSnapshot> cacheMetrics() {
        try {
            return Optional.of(metricsCounter.snapshot());
        } catch (CacheStoreException ex) {
            log.warn("Could not read cache metrics: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public boolean isKnownDataset(String name) {
        return knownDatasets.contains(name);
    }

    public Set<String> knownDatasets() {
        return knownDatasets;
    }

    public Duration ttl() {
        return ttl;
    }

    public int targetChunkCount() {
        return targetChunkCount;
    }

    private static void verifyReachable(KeyValueStore store, int attempts, Duration backoff) {
        int maxAttempts = Math.max(1, attempts);
        RetryConfig config = RetryConfig.<Boolean>custom()
                .maxAttempts(maxAttempts)
                .waitDuration(backoff == null || backoff.isNegative() ? Duration.ZERO : backoff)
                .retryOnResult(reachable -> !Boolean.TRUE.equals(reachable))
                .retryExceptions(CacheStoreException.class)
                .failAfterMaxAttempts(true)
                .build();
        Retry retry = Retry.of("datacache-store-ping", config);
        retry.getEventPublisher().onRetry(e ->
                log.warn("Store not reachable (attempt {}/{}), retrying", e.getNumberOfRetryAttempts(), maxAttempts));

        try {
            Retry.decorateSupplier(retry, store::ping).get();
        } catch (CacheStoreException | MaxRetriesExceededException ex) {
            log.error("Store connection failed after {} attempts", maxAttempts, ex);
            throw new CacheStoreUnavailableException("Key-value store not reachable after " + maxAttempts + " attempts", ex);
        }
    }
}
