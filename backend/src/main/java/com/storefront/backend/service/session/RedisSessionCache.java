package com.storefront.backend.service.session;

import com.storefront.backend.exception.SessionCacheUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed session cache. Values are JSON session records; refresh and
 * access entries carry a TTL so Redis expires them with the token.
 */
public class RedisSessionCache implements SessionCache {

    private final StringRedisTemplate redisTemplate;
    private final SessionRecordCodec codec;
    private final String keyPrefix;

    public RedisSessionCache(StringRedisTemplate redisTemplate, SessionRecordCodec codec, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public void put(String key, SessionRecord record, Duration ttl) {
        String value = codec.encode(record);
        try {
            if (ttl == null) {
                redisTemplate.opsForValue().set(keyPrefix + key, value);
            } else {
                redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
            }
        } catch (DataAccessException e) {
            throw new SessionCacheUnavailableException("Redis SET failed", e);
        }
    }

    @Override
    public Optional<SessionRecord> get(String key) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new SessionCacheUnavailableException("Redis GET failed", e);
        }
        return Optional.ofNullable(value).map(codec::decode);
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(keyPrefix + key));
        } catch (DataAccessException e) {
            throw new SessionCacheUnavailableException("Redis DEL failed", e);
        }
    }

    @Override
    public Optional<SessionRecord> take(String key) {
        String value;
        try {
            value = redisTemplate.opsForValue().getAndDelete(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new SessionCacheUnavailableException("Redis GETDEL failed", e);
        }
        return Optional.ofNullable(value).map(codec::decode);
    }
}
