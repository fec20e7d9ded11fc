package com.github.dimitryivaniuta.datacache.cache;

/**
 * Root of the cache layer's exceptions. All of them are unchecked; callers of
 * {@link CacheFacade} only ever see {@link com.github.dimitryivaniuta.datacache.cache.store.CacheStoreUnavailableException}
 * (at construction) and, through the analytics layer, {@link DatasetUnavailableException}.
 */
public class DataCacheException extends RuntimeException {

    public DataCacheException(String message) {
        super(message);
    }

    public DataCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
