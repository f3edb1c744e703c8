package com.metascan.explorer.modules.cache;

import lombok.Value;

/**
 * HTTP method plus the full request URL including its query string.
 */
@Value
public class CacheKey {
    String method;
    String url;

    public static CacheKey of(String method, String url, String queryString) {
        return new CacheKey(method, queryString == null || queryString.isEmpty() ? url : url + "?" + queryString);
    }

    public String render(String prefix) {
        return prefix + ":" + method + "-" + url;
    }
}
