package com.github.dimitryivaniuta.datacache.cache.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * The subset of a Redis-like key-value store the cache layer relies on.
 *
 * <p>Expiry applies to a whole key, never to individual hash fields.
 * Implementations report client/transport failures as {@link CacheStoreException}.
 */
public interface KeyValueStore {

    /** @return true if the store answered the connectivity check */
    boolean ping();

    boolean exists(String key);

    /** @return true if the key existed and was removed */
    boolean delete(String key);

    void hset(String key, String field, String value);

    /** @return all fields of the hash, empty if the key is absent */
    Map<String, String> hgetAll(String key);

    Optional<String> hget(String key, String field);

    /** @return number of fields in the hash, 0 if the key is absent */
    long hlen(String key);

    /** @return true if the timeout was set (false if the key does not exist) */
    boolean expire(String key, Duration ttl);

    /** Atomic increment; an absent key counts from 0. */
    long incr(String key);

    Optional<String> get(String key);

    /** Atomically moves {@code key} onto {@code newKey}, replacing whatever {@code newKey} held. */
    void rename(String key, String newKey);
}
