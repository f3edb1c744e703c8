package com.metascan.explorer.modules.cache;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Memoizes rendered responses for a fixed time.
 *
 * <p>Concurrent misses on the same key may each compute; the last write wins.</p>
 */
public interface ResponseCache {

    CachedResponse getOrCompute(CacheKey key, Duration ttl, Supplier<String> compute);
}
