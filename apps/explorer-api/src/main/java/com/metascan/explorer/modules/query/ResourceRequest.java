package com.metascan.explorer.modules.query;

import com.metascan.explorer.config.ExplorerProperties;
import lombok.Value;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Filters, paging and relationship includes of one list or detail request.
 */
@Value
public class ResourceRequest {
    FilterParams filters;
    PageParams page;
    Set<String> include;

    public static ResourceRequest of(MultiValueMap<String, String> params, ExplorerProperties.Paging paging) {
        Set<String> include = new LinkedHashSet<>();
        if (params != null && params.get("include") != null) {
            for (String value : params.get("include")) {
                for (String name : StringUtils.commaDelimitedListToStringArray(value)) {
                    if (StringUtils.hasText(name)) {
                        include.add(name.trim());
                    }
                }
            }
        }
        return new ResourceRequest(FilterParams.of(params), PageParams.of(params, paging), include);
    }

    public boolean includes(String relationship) {
        return include.contains(relationship);
    }
}
