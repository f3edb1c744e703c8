package com.metascan.explorer.modules.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Response cache in Redis: one string key per response, expiring with the key's TTL.
 * A failing Redis degrades to computing every response.
 */
@Slf4j
public class RedisResponseCache implements ResponseCache {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisResponseCache(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public CachedResponse getOrCompute(CacheKey key, Duration ttl, Supplier<String> compute) {
        String redisKey = key.render(keyPrefix);
        try {
            String cached = redisTemplate.opsForValue().get(redisKey);
            if (cached != null) {
                log.debug("Redis HIT: {}", redisKey);
                return new CachedResponse(cached, CacheStatus.HIT);
            }
        } catch (RuntimeException e) {
            log.warn("Redis read failed for key: {}, computing response", redisKey, e);
        }

        log.debug("Redis MISS: {}", redisKey);
        String body = compute.get();
        try {
            redisTemplate.opsForValue().set(redisKey, body, ttl);
            log.debug("Redis SET: {} for {}s", redisKey, ttl.toSeconds());
        } catch (RuntimeException e) {
            log.warn("Failed to cache response in Redis: {}", redisKey, e);
        }
        return new CachedResponse(body, CacheStatus.MISS);
    }
}
