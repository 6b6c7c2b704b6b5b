package com.parcel.search.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(SearchCacheProperties.class)
public class CacheBackendConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheBackendConfig.class);

    @Bean
    public CacheBackend cacheBackend(
        SearchCacheProperties properties,
        ObjectProvider<StringRedisTemplate> redisProvider
    ) {
        if (!"redis".equalsIgnoreCase(properties.getBackend())) {
            logger.info("Using in-memory search cache (max {} entries)", properties.getMaxEntries());
            return new InMemoryCacheBackend(properties.getMaxEntries());
        }
        StringRedisTemplate template = redisProvider.getIfAvailable();
        if (template == null) {
            logger.warn("search.cache.backend=redis but no Redis connection is configured; using in-memory cache");
            return new InMemoryCacheBackend(properties.getMaxEntries());
        }
        RedisCacheBackend redis = new RedisCacheBackend(template);
        if (!properties.isFallbackToMemory()) {
            return redis;
        }
        try {
            redis.ping();
            logger.info("Using Redis search cache");
            return redis;
        } catch (RuntimeException e) {
            logger.warn("Redis not reachable ({}); using in-memory cache", e.getMessage());
            return new InMemoryCacheBackend(properties.getMaxEntries());
        }
    }
}
