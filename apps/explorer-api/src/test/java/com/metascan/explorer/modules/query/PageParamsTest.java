package com.metascan.explorer.modules.query;

import com.metascan.explorer.config.ExplorerProperties;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PageParamsTest {

    private final ExplorerProperties.Paging paging = new ExplorerProperties.Paging(25, 100);

    @Test
    void defaultsToFirstPage() {
        PageParams page = PageParams.of(null, paging);

        assertEquals(1, page.getNumber());
        assertEquals(25, page.getSize());
        assertEquals(0, page.getOffset());
    }

    @Test
    void clampsOutOfRangeValues() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("page[number]", "0");
        params.add("page[size]", "5000");

        PageParams page = PageParams.of(params, paging);

        assertEquals(1, page.getNumber());
        assertEquals(100, page.getSize());
    }

    @Test
    void offsetFollowsPageNumber() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("page[number]", "3");
        params.add("page[size]", "10");

        assertEquals(20, PageParams.of(params, paging).getOffset());
    }

    @Test
    void offsetOfDistantPageDoesNotWrap() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("page[number]", "100000000");
        params.add("page[size]", "25");

        assertEquals(2_499_999_975L, PageParams.of(params, paging).getOffset());
    }
}
