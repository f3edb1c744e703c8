package com.metascan.explorer.config;

import com.metascan.explorer.modules.cache.LocalResponseCache;
import com.metascan.explorer.modules.cache.RedisResponseCache;
import com.metascan.explorer.modules.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the response cache backend from {@code explorer.cache.type}.
 */
@Slf4j
@Configuration
public class CacheConfig {

    private static final long LOCAL_MAXIMUM_SIZE = 10_000;

    @Bean
    public ResponseCache responseCache(ExplorerProperties properties,
                                       ObjectProvider<StringRedisTemplate> redisTemplate) {
        ExplorerProperties.Cache cache = properties.getCache();
        if (cache.getType() == ExplorerProperties.CacheType.LOCAL) {
            log.info("Response cache: in-process, prefix {}", cache.getKeyPrefix());
            return new LocalResponseCache(cache.getKeyPrefix(), LOCAL_MAXIMUM_SIZE);
        }
        log.info("Response cache: Redis, prefix {}", cache.getKeyPrefix());
        return new RedisResponseCache(redisTemplate.getObject(), cache.getKeyPrefix());
    }
}
