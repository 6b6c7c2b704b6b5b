package com.parcel.search.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class CacheBackendConfigTest {

    private final CacheBackendConfig config = new CacheBackendConfig();

    @Mock
    private ObjectProvider<StringRedisTemplate> redisProvider;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Test
    void memoryIsTheDefault() {
        CacheBackend backend = config.cacheBackend(new SearchCacheProperties(), redisProvider);

        assertThat(backend).isInstanceOf(InMemoryCacheBackend.class);
        verify(redisProvider, never()).getIfAvailable();
    }

    @Test
    void reachableRedisIsUsed() {
        SearchCacheProperties properties = redisProperties(true);
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        assertThat(config.cacheBackend(properties, redisProvider)).isInstanceOf(RedisCacheBackend.class);
    }

    @Test
    void unreachableRedisFallsBackToMemory() {
        SearchCacheProperties properties = redisProperties(true);
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class)))
            .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(config.cacheBackend(properties, redisProvider)).isInstanceOf(InMemoryCacheBackend.class);
    }

    @Test
    void fallbackCanBeDisabled() {
        SearchCacheProperties properties = redisProperties(false);
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);

        assertThat(config.cacheBackend(properties, redisProvider)).isInstanceOf(RedisCacheBackend.class);
    }

    private SearchCacheProperties redisProperties(boolean fallback) {
        SearchCacheProperties properties = new SearchCacheProperties();
        properties.setBackend("redis");
        properties.setFallbackToMemory(fallback);
        return properties;
    }
}
