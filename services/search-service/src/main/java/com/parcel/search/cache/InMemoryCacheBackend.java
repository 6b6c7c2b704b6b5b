package com.parcel.search.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process backend. Visible only inside this JVM; entries vanish on restart.
 */
public class InMemoryCacheBackend implements CacheBackend {
    private final TtlCache<String> values;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScoredSet> sortedSets = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheBackend(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public InMemoryCacheBackend(int maxEntries, Clock clock) {
        this.values = new TtlCache<>(maxEntries, clock);
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Optional<String> get(String key) {
        return values.get(key).map(CacheEntry::getValue);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, value, ttl.toMillis());
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = values.removeByPrefix(prefix);
        removed += removeByPrefix(counters, prefix);
        removed += removeByPrefix(sortedSets, prefix);
        return removed;
    }

    @Override
    public long increment(String key, Duration ttl) {
        long now = clock.millis();
        Counter counter = counters.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new Counter(now + ttl.toMillis());
            }
            return existing;
        });
        synchronized (counter) {
            counter.value += 1;
            return counter.value;
        }
    }

    @Override
    public long getCounter(String key) {
        Counter counter = counters.get(key);
        if (counter == null) {
            return 0L;
        }
        if (counter.isExpired(clock.millis())) {
            counters.remove(key, counter);
            return 0L;
        }
        synchronized (counter) {
            return counter.value;
        }
    }

    @Override
    public void incrementScore(String key, String member, double delta, Duration ttl) {
        long now = clock.millis();
        sortedSets.compute(key, (k, existing) -> {
            ScoredSet set = existing == null || existing.isExpired(now) ? new ScoredSet() : existing;
            set.scores.merge(member, delta, Double::sum);
            set.expiresAt = now + ttl.toMillis();
            return set;
        });
    }

    @Override
    public List<ScoredMember> topScores(String key, int limit) {
        ScoredSet set = sortedSets.get(key);
        if (set == null || limit <= 0) {
            return List.of();
        }
        if (set.isExpired(clock.millis())) {
            sortedSets.remove(key, set);
            return List.of();
        }
        List<ScoredMember> members = new ArrayList<>();
        for (Map.Entry<String, Double> entry : set.scores.entrySet()) {
            members.add(new ScoredMember(entry.getKey(), entry.getValue()));
        }
        members.sort(Comparator.comparingDouble(ScoredMember::score).reversed()
            .thenComparing(ScoredMember::member));
        return members.size() > limit ? List.copyOf(members.subList(0, limit)) : List.copyOf(members);
    }

    @Override
    public long size() {
        return values.size() + counters.size() + sortedSets.size();
    }

    @Override
    public void ping() {
    }

    private static long removeByPrefix(ConcurrentHashMap<String, ?> map, String prefix) {
        long removed = 0;
        for (String key : map.keySet()) {
            if ((prefix == null || key.startsWith(prefix)) && map.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private static class Counter {
        private final long expiresAt;
        private long value;

        private Counter(long expiresAt) {
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long nowMs) {
            return nowMs > expiresAt;
        }
    }

    private static class ScoredSet {
        private final ConcurrentHashMap<String, Double> scores = new ConcurrentHashMap<>();
        private volatile long expiresAt;

        private boolean isExpired(long nowMs) {
            return nowMs > expiresAt;
        }
    }
}
