package com.parcel.search.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Raw key/value store behind the cache namespaces. Keys are opaque strings and values are
 * serialized JSON. Implementations may throw on I/O problems; {@link CacheCoordinator} absorbs them.
 */
public interface CacheBackend {

    String name();

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /** Removes every key starting with {@code prefix} and returns how many were removed. */
    long deleteByPrefix(String prefix);

    /** Atomically adds one; the expiry is applied when the counter is created. */
    long increment(String key, Duration ttl);

    long getCounter(String key);

    /** Adds {@code delta} to a member of a sorted set and pushes the whole set's expiry forward. */
    void incrementScore(String key, String member, double delta, Duration ttl);

    /** Members in descending score order. */
    List<ScoredMember> topScores(String key, int limit);

    long size();

    void ping();

    record ScoredMember(String member, double score) {
    }
}
