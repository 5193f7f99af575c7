package com.embedcache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for embed-cache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "embedcache")
public class EmbedCacheProperties {

    private CacheConfig cache = new CacheConfig();
    private RedisConfig redis = new RedisConfig();

    public enum Backend {
        MEMORY,
        REDIS
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Backend backend = Backend.MEMORY;
    }

    @Data
    public static class RedisConfig {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String username;
        private String password;
        private boolean ssl = false;

        /**
         * Upper bound for a single GET/SET round trip.
         */
        private Duration timeout = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(2);

        /**
         * Native Redis expiry for written entries. Null keeps entries until the server evicts them.
         */
        private Duration ttl;
    }
}
