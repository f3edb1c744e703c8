package com.metascan.explorer.modules.search;

import com.metascan.explorer.entity.SearchIndex;
import com.metascan.explorer.repository.SearchIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands an account and a set of index categories into the ordered keys of the records to show.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchIndexResolver {

    private final SearchIndexRepository searchIndexRepository;

    /**
     * Keys ordered by sorting value, most recent first. Entries without a position for the requested
     * target are skipped; a key reached through several categories appears once.
     */
    public List<BlockPosition> expand(Collection<Integer> categories, String accountId, IndexTarget target) {
        if (categories.isEmpty() || accountId == null) {
            return List.of();
        }
        List<SearchIndex> entries = searchIndexRepository
                .findByIndexTypeIdInAndAccountIdOrderBySortingValueDesc(categories, accountId);

        Set<BlockPosition> keys = new LinkedHashSet<>();
        for (SearchIndex entry : entries) {
            Integer idx = target == IndexTarget.EXTRINSIC ? entry.getExtrinsicIdx() : entry.getEventIdx();
            if (entry.getBlockId() != null && idx != null) {
                keys.add(new BlockPosition(entry.getBlockId(), idx));
            }
        }
        log.debug("Search index expanded categories={} to {} {} keys", categories, keys.size(), target);
        return new ArrayList<>(keys);
    }
}
