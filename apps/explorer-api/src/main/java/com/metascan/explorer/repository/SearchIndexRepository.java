package com.metascan.explorer.repository;

import com.metascan.explorer.entity.SearchIndex;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SearchIndexRepository extends JpaRepository<SearchIndex, Long> {

    /**
     * Index entries of one account across the given categories, most recent first.
     */
    List<SearchIndex> findByIndexTypeIdInAndAccountIdOrderBySortingValueDesc(Collection<Integer> indexTypeIds,
                                                                            String accountId);
}
