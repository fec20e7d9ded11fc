package com.github.dimitryivaniuta.datacache.cache.store;

import com.github.dimitryivaniuta.datacache.cache.DataCacheException;

public class CacheStoreException extends DataCacheException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
