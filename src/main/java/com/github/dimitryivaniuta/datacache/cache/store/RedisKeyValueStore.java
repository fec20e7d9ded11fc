package com.github.dimitryivaniuta.datacache.cache.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} on top of Spring Data Redis. Everything is plain strings
 * (StringRedisTemplate), so entries stay readable from redis-cli.
 */
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;

    @Override
    public boolean ping() {
        String pong = call("PING", "-", () -> redis.execute((RedisCallback<String>) connection -> connection.ping()));
        return "PONG".equalsIgnoreCase(pong);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("EXISTS", key, () -> redis.hasKey(key)));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("DEL", key, () -> redis.delete(key)));
    }

    @Override
    public void hset(String key, String field, String value) {
        call("HSET", key, () -> {
            hash().put(key, field, value);
            return null;
        });
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        Map<String, String> entries = call("HGETALL", key, () -> hash().entries(key));
        return entries == null ? Map.of() : entries;
    }

    @Override
    public Optional<String> hget(String key, String field) {
        return Optional.ofNullable(call("HGET", key, () -> hash().get(key, field)));
    }

    @Override
    public long hlen(String key) {
        Long size = call("HLEN", key, () -> hash().size(key));
        return size == null ? 0L : size;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return Boolean.TRUE.equals(call("EXPIRE", key, () -> redis.expire(key, ttl)));
    }

    @Override
    public long incr(String key) {
        Long v = call("INCR", key, () -> redis.opsForValue().increment(key));
        if (v == null) {
            // only happens inside a pipeline/transaction, which this adapter never opens
            throw new CacheStoreException("INCR " + key + " returned no value");
        }
        return v;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("GET", key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void rename(String key, String newKey) {
        call("RENAME", key, () -> {
            redis.rename(key, newKey);
            return null;
        });
    }

    private HashOperations<String, String, String> hash() {
        return redis.opsForHash();
    }

    private static <T> T call(String command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new CacheStoreException(command + " " + key + " failed: " + ex.getMessage(), ex);
        }
    }
}
