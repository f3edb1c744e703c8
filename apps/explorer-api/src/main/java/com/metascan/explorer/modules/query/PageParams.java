package com.metascan.explorer.modules.query;

import com.metascan.explorer.config.ExplorerProperties;
import lombok.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.util.MultiValueMap;

/**
 * 1-based page number and page size taken from {@code page[number]} and {@code page[size]}.
 */
@Value
public class PageParams {
    int number;
    int size;

    public static PageParams of(MultiValueMap<String, String> params, ExplorerProperties.Paging paging) {
        int number = parse(params == null ? null : params.getFirst("page[number]"), 1);
        int size = parse(params == null ? null : params.getFirst("page[size]"), paging.getDefaultSize());
        return new PageParams(Math.max(1, number), Math.min(Math.max(1, size), paging.getMaxSize()));
    }

    public long getOffset() {
        return (long) (number - 1) * size;
    }

    public PageRequest toPageRequest(Sort sort) {
        return PageRequest.of(number - 1, size, sort);
    }

    private static int parse(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
