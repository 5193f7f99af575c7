package com.embedcache.repository;

import com.embedcache.config.EmbedCacheProperties;
import com.embedcache.model.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store.
 *
 * Key and value bytes are written as-is: the key is the raw 32-byte digest and the value
 * is the encoded vector. Each call is a single GET or SET round trip bounded by the Lettuce
 * command timeout; Spring Data exceptions are translated into {@link CacheBackendException}.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private final RedisTemplate<byte[], byte[]> redisTemplate;
    private final EmbedCacheProperties.RedisConfig config;

    public RedisCacheStore(RedisTemplate<byte[], byte[]> redisTemplate, EmbedCacheProperties properties) {
        this.redisTemplate = redisTemplate;
        this.config = properties.getRedis();
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        try {
            byte[] value = redisTemplate.opsForValue().get(key.toBytes());
            if (value == null) {
                log.debug("Redis cache miss: {}", key);
                return Optional.empty();
            }
            log.debug("Redis cache hit: {}, size={}B", key, value.length);
            return Optional.of(value);
        } catch (RuntimeException e) {
            throw translate("GET", key, e);
        }
    }

    @Override
    public void set(CacheKey key, byte[] value) {
        try {
            Duration ttl = config.getTtl();
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                redisTemplate.opsForValue().set(key.toBytes(), value, ttl);
            } else {
                redisTemplate.opsForValue().set(key.toBytes(), value);
            }
            log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", key, ttl, value.length);
        } catch (RuntimeException e) {
            throw translate("SET", key, e);
        }
    }

    private CacheBackendException translate(String command, CacheKey key, RuntimeException e) {
        if (e instanceof QueryTimeoutException) {
            return new CacheTimeoutException(
                    "Redis " + command + " timed out after " + config.getTimeout() + ": key=" + key,
                    config.getTimeout(), e);
        }
        return new CacheBackendException("Redis " + command + " failed: key=" + key, e);
    }
}
