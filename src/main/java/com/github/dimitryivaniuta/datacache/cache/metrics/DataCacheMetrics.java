package com.github.dimitryivaniuta.datacache.cache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Process-local Micrometer meters. The cross-process hit/miss totals live in the store
 * ({@link CacheMetricsCounter}); these are for scraping a single instance.
 */
@Component
public class DataCacheMetrics {

    private final MeterRegistry registry;

    public DataCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Query cache ----
    public void queryHit(String dataset, String queryType) {
        Counter.builder("datacache_query_hits_total")
                .tag("dataset", dataset)
                .tag("query_type", queryType)
                .register(registry)
                .increment();
    }

    public void queryMiss(String dataset, String queryType) {
        Counter.builder("datacache_query_misses_total")
                .tag("dataset", dataset)
                .tag("query_type", queryType)
                .register(registry)
                .increment();
    }

    // ---- Dataset cache ----
    public void datasetLoad(String dataset, String outcome) {
        Counter.builder("datacache_dataset_load_total")
                .tag("dataset", dataset)
                .tag("outcome", outcome) // hit | miss | failure
                .register(registry)
                .increment();
    }

    public void datasetPopulate(String dataset, boolean success, long nanos) {
        Counter.builder("datacache_dataset_populate_total")
                .tag("dataset", dataset)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();

        Timer.builder("datacache_dataset_populate_duration_seconds")
                .tag("dataset", dataset)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
