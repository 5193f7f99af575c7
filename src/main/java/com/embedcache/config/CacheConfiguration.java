package com.embedcache.config;

import com.embedcache.repository.CacheStore;
import com.embedcache.repository.InMemoryCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache store configuration for the in-process backend.
 * Redis wiring lives in {@link RedisConfiguration}.
 */
@Configuration
public class CacheConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "embedcache.cache", name = "backend", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore() {
        return new InMemoryCacheStore();
    }
}
