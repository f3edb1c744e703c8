package com.metascan.explorer.modules.cache;

import lombok.Value;

/**
 * A rendered response body and whether it came from the cache.
 */
@Value
public class CachedResponse {
    String body;
    CacheStatus status;
}
