package com.metascan.explorer.modules.query;

import com.metascan.explorer.modules.search.BlockPosition;
import com.metascan.explorer.modules.search.SearchIndexResolver;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves list and detail requests against the store.
 *
 * <p>A list request is answered either through the search index, when the resource has a binding
 * and the request names categories, or through field filters. Never both: with search-index
 * categories present the field filters are not applied and the index order wins.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryResolver {

    private final SearchIndexResolver searchIndexResolver;
    private final Tracer tracer;

    public <T> ResolvedPage<T> resolve(ListQuery<T> query, ResourceRequest request) {
        Span span = tracer.spanBuilder("explorer.resolve")
                .setAttribute("explorer.resource", query.getResource())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            ResolvedPage<T> page = resolveInSpan(query, request);
            span.setAttribute("explorer.search_index", page.isSearchIndexUsed());
            span.setAttribute("explorer.total", page.getTotal());
            return page;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Detail lookup. The lookup returns empty for unmatched or malformed keys.
     */
    public <T> Optional<T> getItem(String resource, String id, Supplier<Optional<T>> lookup) {
        Span span = tracer.spanBuilder("explorer.resolve")
                .setAttribute("explorer.resource", resource)
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            Optional<T> item = lookup.get();
            span.setAttribute("explorer.found", item.isPresent());
            if (item.isEmpty()) {
                log.debug("No {} for id {}", resource, id);
            }
            return item;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> ResolvedPage<T> resolveInSpan(ListQuery<T> query, ResourceRequest request) {
        FilterParams filters = request.getFilters();
        PageParams page = request.getPage();
        SearchIndexBinding<T> binding = query.getSearchIndex();
        if (binding != null) {
            List<Integer> categories = binding.getCategories().apply(filters);
            if (!categories.isEmpty()) {
                return resolveThroughIndex(binding, categories, filters, page);
            }
        }

        Page<T> result = query.getExecutor().findAll(
                query.getFilters().apply(filters),
                page.toPageRequest(query.getSort()));
        return new ResolvedPage<>(result.getContent(), result.getTotalElements(),
                page.getNumber(), page.getSize(), false);
    }

    private <T> ResolvedPage<T> resolveThroughIndex(SearchIndexBinding<T> binding,
                                                    List<Integer> categories,
                                                    FilterParams filters,
                                                    PageParams page) {
        String accountId = filters.getDecodedDid(FilterParams.ADDRESS).orElse(null);
        List<BlockPosition> positions = searchIndexResolver.expand(categories, accountId, binding.getTarget());

        int from = (int) Math.min(page.getOffset(), positions.size());
        int to = Math.min(from + page.getSize(), positions.size());
        List<BlockPosition> slice = positions.subList(from, to);
        if (slice.isEmpty()) {
            return new ResolvedPage<>(List.of(), positions.size(), page.getNumber(), page.getSize(), true);
        }

        Map<BlockPosition, T> loaded = new HashMap<>();
        for (T record : binding.getLoader().apply(slice)) {
            loaded.put(binding.getPositionOf().apply(record), record);
        }
        List<T> ordered = new ArrayList<>(slice.size());
        for (BlockPosition position : slice) {
            T record = loaded.get(position);
            if (record != null) {
                ordered.add(record);
            }
        }
        return new ResolvedPage<>(ordered, positions.size(), page.getNumber(), page.getSize(), true);
    }
}
