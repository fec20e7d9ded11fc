package com.github.dimitryivaniuta.datacache.cache.query;

import java.util.Objects;

/**
 * Identity of a cached query result. {@link #storeKey()} is a pure function of the three
 * fields: {@code <dataset>:<queryType>:<queryValue>}.
 */
public record QueryKey(String dataset, String queryType, String queryValue) {

    public QueryKey {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(queryType, "queryType must not be null");
        Objects.requireNonNull(queryValue, "queryValue must not be null");
    }

    public String storeKey() {
        return dataset + ":" + queryType + ":" + queryValue;
    }
}
