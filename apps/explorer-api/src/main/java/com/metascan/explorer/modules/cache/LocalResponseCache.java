package com.metascan.explorer.modules.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * In-process response cache. Each entry expires after the TTL it was stored with.
 */
@Slf4j
public class LocalResponseCache implements ResponseCache {

    private final Cache<String, Entry> cache;
    private final String keyPrefix;

    public LocalResponseCache(String keyPrefix, long maximumSize) {
        this(keyPrefix, maximumSize, Ticker.systemTicker());
    }

    LocalResponseCache(String keyPrefix, long maximumSize, Ticker ticker) {
        this.keyPrefix = keyPrefix;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public CachedResponse getOrCompute(CacheKey key, Duration ttl, Supplier<String> compute) {
        String cacheKey = key.render(keyPrefix);
        Entry cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Local cache HIT: {}", cacheKey);
            return new CachedResponse(cached.body, CacheStatus.HIT);
        }
        log.debug("Local cache MISS: {}", cacheKey);
        String body = compute.get();
        cache.put(cacheKey, new Entry(body, ttl));
        return new CachedResponse(body, CacheStatus.MISS);
    }

    private static final class Entry {
        private final String body;
        private final Duration ttl;

        private Entry(String body, Duration ttl) {
            this.body = body;
            this.ttl = ttl;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
