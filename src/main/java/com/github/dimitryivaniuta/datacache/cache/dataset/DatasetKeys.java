package com.github.dimitryivaniuta.datacache.cache.dataset;

import java.util.UUID;

/**
 * Store key layout of dataset entries. Other consumers of the same store depend on it;
 * do not change the formats.
 */
public final class DatasetKeys {
    private DatasetKeys() {}

    private static final String ENTRY_SUFFIX = "_data";
    private static final String STAGING_INFIX = ":staging:";

    /** {@code <name>_data}: one hash per dataset, field = chunk index. */
    public static String entryKey(String name) {
        return name + ENTRY_SUFFIX;
    }

    /** {@code <name>_data:staging:<uuid>}: private to one populate attempt. */
    public static String stagingKey(String name) {
        return entryKey(name) + STAGING_INFIX + UUID.randomUUID();
    }

    public static String chunkField(int index) {
        return Integer.toString(index);
    }
}
