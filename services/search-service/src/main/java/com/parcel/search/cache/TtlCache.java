package com.parcel.search.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expiry-based map. Expired entries are dropped when read; once the size cap is exceeded, expired
 * entries are purged and then the entry closest to its expiry is evicted.
 */
public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.millis();
        entries.put(key, new CacheEntry<>(value, now, now + ttlMs));
        evictIfNeeded();
    }

    public long removeByPrefix(String prefix) {
        long removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            String key = keys.next();
            if (prefix == null || key.startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private void evictIfNeeded() {
        if (entries.size() <= maxEntries) {
            return;
        }
        long now = clock.millis();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        while (entries.size() > maxEntries) {
            Map.Entry<String, CacheEntry<V>> nearest = null;
            for (Map.Entry<String, CacheEntry<V>> candidate : entries.entrySet()) {
                if (nearest == null || candidate.getValue().getExpiresAt() < nearest.getValue().getExpiresAt()) {
                    nearest = candidate;
                }
            }
            if (nearest == null) {
                break;
            }
            entries.remove(nearest.getKey(), nearest.getValue());
        }
    }
}
