package com.metascan.explorer.modules.cache;

public enum CacheStatus {
    HIT,
    MISS
}
