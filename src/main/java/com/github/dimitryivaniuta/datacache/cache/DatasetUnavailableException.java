package com.github.dimitryivaniuta.datacache.cache;

import lombok.Getter;

/**
 * Raised by consumers of the facade when a dataset could neither be loaded from the store
 * nor populated from its source.
 */
@Getter
public class DatasetUnavailableException extends DataCacheException {

    private final String dataset;

    public DatasetUnavailableException(String dataset) {
        super("Dataset '" + dataset + "' is not available from cache or source");
        this.dataset = dataset;
    }
}
