package com.github.dimitryivaniuta.datacache.cache.store;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Redis-like store for unit tests: hashes, strings, whole-key expiry on a manual clock,
 * and injectable failures.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, String> strings = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private Instant now = Instant.parse("2024-01-01T00:00:00Z");

    private boolean reachable = true;
    private Predicate<String> failingCommands = c -> false; // e.g. "HSET", "HGET"
    private final Set<String> commandsSeen = ConcurrentHashMap.newKeySet();

    // ---- test controls ----

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void failOn(String... commands) {
        Set<String> s = Set.of(commands);
        failingCommands = s::contains;
    }

    public void failWhen(Predicate<String> commandPredicate) {
        failingCommands = commandPredicate;
    }

    public void failNothing() {
        failingCommands = c -> false;
    }

    /** Fails the n-th (1-based) HSET from now on, and only that one. */
    public void failNthHset(int n) {
        int[] seen = {0};
        failingCommands = c -> "HSET".equals(c) && ++seen[0] == n;
    }

    public Set<String> keys() {
        purgeExpired();
        Set<String> keys = new HashSet<>(hashes.keySet());
        keys.addAll(strings.keySet());
        return Set.copyOf(keys);
    }

    public Optional<Duration> ttl(String key) {
        purgeExpired();
        Instant at = expiries.get(key);
        return at == null ? Optional.empty() : Optional.of(Duration.between(now, at));
    }

    public void rawHset(String key, String field, String value) {
        hash(key, true).put(field, value);
    }

    public boolean sawCommand(String command) {
        return commandsSeen.contains(command);
    }

    // ---- KeyValueStore ----

    @Override
    public boolean ping() {
        check("PING");
        if (!reachable) {
            throw new CacheStoreException("connection refused");
        }
        return true;
    }

    @Override
    public boolean exists(String key) {
        check("EXISTS");
        purgeExpired();
        return contains(key);
    }

    @Override
    public boolean delete(String key) {
        check("DEL");
        purgeExpired();
        expiries.remove(key);
        boolean removed = hashes.remove(key) != null;
        return strings.remove(key) != null || removed;
    }

    @Override
    public void hset(String key, String field, String value) {
        check("HSET");
        purgeExpired();
        hash(key, true).put(field, value);
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        check("HGETALL");
        purgeExpired();
        Map<String, String> h = hash(key, false);
        return h == null ? Map.of() : new LinkedHashMap<>(h);
    }

    @Override
    public Optional<String> hget(String key, String field) {
        check("HGET");
        purgeExpired();
        Map<String, String> h = hash(key, false);
        return h == null ? Optional.empty() : Optional.ofNullable(h.get(field));
    }

    @Override
    public long hlen(String key) {
        check("HLEN");
        purgeExpired();
        Map<String, String> h = hash(key, false);
        return h == null ? 0L : h.size();
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        check("EXPIRE");
        purgeExpired();
        if (!contains(key)) return false;
        expiries.put(key, now.plus(ttl));
        return true;
    }

    @Override
    public long incr(String key) {
        check("INCR");
        purgeExpired();
        requireNotHash(key);
        String v = strings.get(key);
        long next = (v == null ? 0L : Long.parseLong(v)) + 1;
        strings.put(key, Long.toString(next));
        return next;
    }

    @Override
    public Optional<String> get(String key) {
        check("GET");
        purgeExpired();
        requireNotHash(key);
        return Optional.ofNullable(strings.get(key));
    }

    @Override
    public void rename(String key, String newKey) {
        check("RENAME");
        purgeExpired();
        if (!contains(key)) {
            throw new CacheStoreException("ERR no such key " + key);
        }
        hashes.remove(newKey);
        strings.remove(newKey);
        if (hashes.containsKey(key)) {
            hashes.put(newKey, hashes.remove(key));
        } else {
            strings.put(newKey, strings.remove(key));
        }
        Instant exp = expiries.remove(key);
        expiries.remove(newKey);
        if (exp != null) {
            expiries.put(newKey, exp);
        }
    }

    private void check(String command) {
        commandsSeen.add(command);
        if (failingCommands.test(command)) {
            throw new CacheStoreException(command + " failed (injected)");
        }
    }

    private Map<String, String> hash(String key, boolean create) {
        if (strings.containsKey(key)) {
            throw new CacheStoreException("WRONGTYPE " + key);
        }
        return create ? hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()) : hashes.get(key);
    }

    private void requireNotHash(String key) {
        if (hashes.containsKey(key)) {
            throw new CacheStoreException("WRONGTYPE " + key);
        }
    }

    private boolean contains(String key) {
        return hashes.containsKey(key) || strings.containsKey(key);
    }

    private void purgeExpired() {
        expiries.entrySet().removeIf(e -> {
            if (!now.isBefore(e.getValue())) {
                hashes.remove(e.getKey());
                strings.remove(e.getKey());
                return true;
            }
            return false;
        });
    }
}
