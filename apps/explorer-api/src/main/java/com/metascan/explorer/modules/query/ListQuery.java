package com.metascan.explorer.modules.query;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.function.Function;

/**
 * Definition of one list resource: where its records live, their default order, and how request
 * filters map to predicates.
 */
@Value
@Builder
public class ListQuery<T> {
    String resource;
    JpaSpecificationExecutor<T> executor;
    Sort sort;
    @Builder.Default
    Function<FilterParams, Specification<T>> filters = ignored -> Specs.all();
    SearchIndexBinding<T> searchIndex;
}
