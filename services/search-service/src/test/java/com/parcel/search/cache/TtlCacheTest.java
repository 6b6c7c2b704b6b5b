package com.parcel.search.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void entryExpiresAfterTtl() {
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("query:a", "value", 300_000L);

        clock.advance(Duration.ofSeconds(300));
        assertTrue(cache.get("query:a").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertFalse(cache.get("query:a").isPresent());
        assertEquals(0, cache.size());
    }

    @Test
    void evictsEntryClosestToExpiryWhenFull() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("long", "1", 10_000L);
        cache.put("short", "2", 1_000L);
        cache.put("medium", "3", 5_000L);

        assertEquals(2, cache.size());
        assertFalse(cache.get("short").isPresent());
        assertTrue(cache.get("long").isPresent());
        assertTrue(cache.get("medium").isPresent());
    }

    @Test
    void expiredEntriesArePurgedBeforeLiveOnes() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("stale", "1", 1_000L);
        cache.put("live", "2", 1_000L);
        clock.advance(Duration.ofMillis(500));
        cache.put("fresh", "3", 60_000L);
        clock.advance(Duration.ofMillis(600));
        cache.put("newest", "4", 60_000L);

        assertTrue(cache.get("fresh").isPresent());
        assertTrue(cache.get("newest").isPresent());
        assertEquals(2, cache.size());
    }

    @Test
    void removeByPrefixOnlyTouchesMatchingKeys() {
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("embed:1", "a", 1_000L);
        cache.put("embed:2", "b", 1_000L);
        cache.put("query:1", "c", 1_000L);

        assertEquals(2, cache.removeByPrefix("embed:"));
        assertTrue(cache.get("query:1").isPresent());
    }

    @Test
    void nonPositiveTtlIsIgnored() {
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("k", "v", 0L);

        assertFalse(cache.get("k").isPresent());
    }
}
