package com.storefront.backend.config;

import com.storefront.backend.service.session.InMemorySessionCache;
import com.storefront.backend.service.session.RedisSessionCache;
import com.storefront.backend.service.session.SessionCache;
import com.storefront.backend.service.session.SessionRecordCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the session cache backend from {@code storefront.auth.cache.type}.
 */
@Slf4j
@Configuration
public class SessionCacheConfig {

    @Bean
    @ConditionalOnProperty(name = "storefront.auth.cache.type", havingValue = "redis", matchIfMissing = true)
    public SessionCache redisSessionCache(StringRedisTemplate redisTemplate,
                                          SessionRecordCodec codec,
                                          AuthProperties authProperties) {
        log.info("Session cache backend: redis (prefix={})", authProperties.getCache().getKeyPrefix());
        return new RedisSessionCache(redisTemplate, codec, authProperties.getCache().getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "storefront.auth.cache.type", havingValue = "memory")
    public SessionCache inMemorySessionCache(Clock clock) {
        log.warn("Session cache backend: in-memory. Sessions are not shared across instances.");
        return new InMemorySessionCache(clock);
    }
}
