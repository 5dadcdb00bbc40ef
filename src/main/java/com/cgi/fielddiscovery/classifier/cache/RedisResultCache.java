package com.cgi.fielddiscovery.classifier.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed result cache.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fielddiscovery.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisResultCache implements ResultCache {

    private final StringRedisTemplate stringRedisTemplate;

    public RedisResultCache(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
        log.info("Using Redis result cache");
    }

    @Override
    public Optional<String> get(String key) {
        String value = stringRedisTemplate.opsForValue().get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        stringRedisTemplate.opsForValue().set(key, value, ttl);
    }
}
