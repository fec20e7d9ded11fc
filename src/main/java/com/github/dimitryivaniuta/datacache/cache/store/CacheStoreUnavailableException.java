package com.github.dimitryivaniuta.datacache.cache.store;

import com.github.dimitryivaniuta.datacache.cache.DataCacheException;

/**
 * The store could not be reached when the facade was built. Nothing in the cache layer
 * can work without it, so this one is not absorbed anywhere.
 */
public class CacheStoreUnavailableException extends DataCacheException {

    public CacheStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
