package com.metascan.explorer.modules.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LocalResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private final LocalResponseCache cache = new LocalResponseCache("explorer:test", 100, ticker);

    @Test
    void secondRequestWithinTtlIsHit() {
        AtomicInteger computations = new AtomicInteger();
        CacheKey key = CacheKey.of("GET", "http://localhost/api/v1/stats", null);

        CachedResponse first = cache.getOrCompute(key, Duration.ofSeconds(6), () -> "body-" + computations.incrementAndGet());
        nanos.addAndGet(Duration.ofSeconds(5).toNanos());
        CachedResponse second = cache.getOrCompute(key, Duration.ofSeconds(6), () -> "body-" + computations.incrementAndGet());

        assertEquals(CacheStatus.MISS, first.getStatus());
        assertEquals(CacheStatus.HIT, second.getStatus());
        assertEquals("body-1", second.getBody());
        assertEquals(1, computations.get());
    }

    @Test
    void entryExpiresAfterItsOwnTtl() {
        CacheKey shortLived = CacheKey.of("GET", "http://localhost/api/v1/stats", null);
        CacheKey longLived = CacheKey.of("GET", "http://localhost/api/v1/runtime-call", null);
        cache.getOrCompute(shortLived, Duration.ofSeconds(6), () -> "stats");
        cache.getOrCompute(longLived, Duration.ofSeconds(3600), () -> "calls");

        nanos.addAndGet(Duration.ofSeconds(7).toNanos());

        assertEquals(CacheStatus.MISS, cache.getOrCompute(shortLived, Duration.ofSeconds(6), () -> "stats").getStatus());
        assertEquals(CacheStatus.HIT, cache.getOrCompute(longLived, Duration.ofSeconds(3600), () -> "calls").getStatus());
    }

    @Test
    void queryStringIsPartOfKey() {
        cache.getOrCompute(CacheKey.of("GET", "http://localhost/api/v1/session/validator", "page[number]=1"),
                Duration.ofSeconds(60), () -> "page-1");

        CachedResponse other = cache.getOrCompute(
                CacheKey.of("GET", "http://localhost/api/v1/session/validator", "page[number]=2"),
                Duration.ofSeconds(60), () -> "page-2");

        assertEquals(CacheStatus.MISS, other.getStatus());
        assertEquals("page-2", other.getBody());
    }
}
