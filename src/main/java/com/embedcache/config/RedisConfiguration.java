package com.embedcache.config;

import com.embedcache.repository.CacheStore;
import com.embedcache.repository.RedisCacheStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.util.StringUtils;

/**
 * Redis configuration for the remote cache backend.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "embedcache.cache", name = "backend", havingValue = "redis")
public class RedisConfiguration {

    private final EmbedCacheProperties properties;

    public RedisConfiguration(EmbedCacheProperties properties) {
        this.properties = properties;
    }

    /**
     * Configure Redis connection factory with bounded waits.
     * Commands fail fast while disconnected instead of queueing behind a reconnect.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        EmbedCacheProperties.RedisConfig redis = properties.getRedis();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        server.setDatabase(redis.getDatabase());
        if (StringUtils.hasText(redis.getUsername())) {
            server.setUsername(redis.getUsername());
        }
        if (StringUtils.hasText(redis.getPassword())) {
            server.setPassword(RedisPassword.of(redis.getPassword()));
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(redis.getConnectTimeout())
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .timeoutOptions(TimeoutOptions.enabled(redis.getTimeout()))
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(redis.getTimeout());
        if (redis.isSsl()) {
            builder.useSsl();
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, builder.build());

        log.info("Configured Redis connection factory: {}:{} db={} timeout={}",
                redis.getHost(), redis.getPort(), redis.getDatabase(), redis.getTimeout());
        return factory;
    }

    /**
     * Redis template that passes key and value bytes through unchanged.
     */
    @Bean
    public RedisTemplate<byte[], byte[]> embeddingRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<byte[], byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(RedisSerializer.byteArray());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashKeySerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate for raw byte storage");
        return template;
    }

    @Bean
    public CacheStore redisCacheStore(RedisTemplate<byte[], byte[]> embeddingRedisTemplate) {
        return new RedisCacheStore(embeddingRedisTemplate, properties);
    }
}
