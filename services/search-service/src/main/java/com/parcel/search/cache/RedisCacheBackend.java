package com.parcel.search.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

/**
 * Shared backend; every search-service instance pointing at the same Redis sees the same entries.
 */
public class RedisCacheBackend implements CacheBackend {
    private final StringRedisTemplate redisTemplate;

    public RedisCacheBackend(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Optional<String> get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        Set<String> keys = redisTemplate.keys((prefix == null ? "" : prefix) + "*");
        if (keys == null || keys.isEmpty()) {
            return 0L;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0L : deleted;
    }

    @Override
    public long increment(String key, Duration ttl) {
        Long count = redisTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            redisTemplate.expire(key, ttl);
        }
        return count == null ? 0L : count;
    }

    @Override
    public long getCounter(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    @Override
    public void incrementScore(String key, String member, double delta, Duration ttl) {
        redisTemplate.opsForZSet().incrementScore(key, member, delta);
        redisTemplate.expire(key, ttl);
    }

    @Override
    public List<ScoredMember> topScores(String key, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<ZSetOperations.TypedTuple<String>> tuples =
            redisTemplate.opsForZSet().reverseRangeWithScores(key, 0, limit - 1L);
        if (tuples == null || tuples.isEmpty()) {
            return List.of();
        }
        List<ScoredMember> members = new ArrayList<>(tuples.size());
        for (ZSetOperations.TypedTuple<String> tuple : tuples) {
            if (tuple.getValue() == null) {
                continue;
            }
            double score = tuple.getScore() == null ? 0.0 : tuple.getScore();
            members.add(new ScoredMember(tuple.getValue(), score));
        }
        return members;
    }

    @Override
    public long size() {
        Long size = redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize());
        return size == null ? 0L : size;
    }

    @Override
    public void ping() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (reply == null) {
            throw new IllegalStateException("redis ping returned no reply");
        }
    }
}
