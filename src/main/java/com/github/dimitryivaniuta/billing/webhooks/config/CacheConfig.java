package com.github.dimitryivaniuta.billing.webhooks.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.CachedLedgerOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis holds final ledger outcomes so a redelivered notification can be answered without a database
 * round trip. Postgres and its unique constraint remain the source of truth for idempotency, so cache
 * errors are logged and otherwise ignored.</p>
 */
@Slf4j
@Configuration
public class CacheConfig implements CachingConfigurer {

    /**
     * Cache name for final ledger outcomes.
     */
    public static final String LEDGER_CACHE = "ledgerOutcome";

    /**
     * Cache manager using Redis with JSON serialization.
     *
     * <p>Not registered when {@code spring.cache.type} is set to anything but {@code redis}; Spring Boot then
     * falls back to its own cache manager (e.g. no-op for {@code none}).</p>
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @param props        application properties
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(prefix = "spring.cache", name = "type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, ObjectMapper objectMapper, AppProperties props) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, CachedLedgerOutcome.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var ledgerCfg = defaultCfg
                .entryTtl(props.getLedger().getCacheTtl())
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(LEDGER_CACHE, ledgerCfg)
                .build();
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException ex, Cache cache, Object key) {
                log.warn("Cache get failed, falling back to database. cache={} key={} error={}", cache.getName(), key, ex.getMessage());
            }

            @Override
            public void handleCachePutError(RuntimeException ex, Cache cache, Object key, Object value) {
                log.warn("Cache put failed. cache={} key={} error={}", cache.getName(), key, ex.getMessage());
            }

            @Override
            public void handleCacheEvictError(RuntimeException ex, Cache cache, Object key) {
                log.warn("Cache evict failed. cache={} key={} error={}", cache.getName(), key, ex.getMessage());
            }

            @Override
            public void handleCacheClearError(RuntimeException ex, Cache cache) {
                log.warn("Cache clear failed. cache={} error={}", cache.getName(), ex.getMessage());
            }
        };
    }
}
