package com.metascan.explorer.modules.query;

import com.metascan.explorer.modules.search.BlockPosition;
import com.metascan.explorer.modules.search.IndexTarget;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * How a list resource is reached through the search index.
 *
 * <p>{@code categories} picks the index categories a request asks for; an empty list means the
 * request is resolved by field filters instead.</p>
 */
@Value
@Builder
public class SearchIndexBinding<T> {
    IndexTarget target;
    Function<FilterParams, List<Integer>> categories;
    Function<List<BlockPosition>, List<T>> loader;
    Function<T, BlockPosition> positionOf;

    /**
     * Categories taken verbatim from {@code filter[search_index]}.
     */
    public static Function<FilterParams, List<Integer>> requestedCategories() {
        return filters -> filters.getIntegers(FilterParams.SEARCH_INDEX);
    }
}
