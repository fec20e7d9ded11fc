package com.github.dimitryivaniuta.datacache.cache.codec;

import com.github.dimitryivaniuta.datacache.cache.DataCacheException;

public class RowCodecException extends DataCacheException {

    public RowCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
