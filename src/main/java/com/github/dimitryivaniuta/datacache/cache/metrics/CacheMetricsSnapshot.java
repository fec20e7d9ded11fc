package com.github.dimitryivaniuta.datacache.cache.metrics;

public record CacheMetricsSnapshot(long hits, long misses) {}
