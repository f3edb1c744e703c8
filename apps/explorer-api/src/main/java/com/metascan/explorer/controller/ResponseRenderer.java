package com.metascan.explorer.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.modules.cache.CacheKey;
import com.metascan.explorer.modules.cache.CachedResponse;
import com.metascan.explorer.modules.cache.ResponseCache;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Writes response documents, going through the response cache for resources that have a TTL.
 * Cached responses carry {@code X-Cache: HIT|MISS}.
 */
@Component
@RequiredArgsConstructor
public class ResponseRenderer {

    static final String CACHE_HEADER = "X-Cache";

    private final ResponseCache responseCache;
    private final JsonApiSerializer serializer;
    private final ExplorerProperties properties;

    public ResponseEntity<String> render(HttpServletRequest request, String resource, Supplier<JsonNode> compute) {
        Optional<Duration> ttl = properties.getCache().ttlFor(resource);
        if (ttl.isEmpty()) {
            return uncached(compute);
        }
        CacheKey key = CacheKey.of(request.getMethod(), request.getRequestURL().toString(), request.getQueryString());
        CachedResponse response = responseCache.getOrCompute(key, ttl.get(), () -> serializer.write(compute.get()));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(CACHE_HEADER, response.getStatus().name())
                .body(response.getBody());
    }

    /**
     * For responses that depend on the caller's identity.
     */
    public ResponseEntity<String> uncached(Supplier<JsonNode> compute) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(serializer.write(compute.get()));
    }
}
