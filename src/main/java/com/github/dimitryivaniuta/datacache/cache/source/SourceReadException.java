package com.github.dimitryivaniuta.datacache.cache.source;

import com.github.dimitryivaniuta.datacache.cache.DataCacheException;

public class SourceReadException extends DataCacheException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
