package com.metascan.explorer.modules.query;

import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;

/**
 * Predicate building blocks for list filters.
 */
public final class Specs {

    private Specs() {
    }

    public static <T> Specification<T> all() {
        return (root, query, cb) -> cb.conjunction();
    }

    public static <T> Specification<T> none() {
        return (root, query, cb) -> cb.disjunction();
    }

    public static <T> Specification<T> equal(String attribute, Object value) {
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    public static <T> Specification<T> notIn(String attribute, Collection<?> values) {
        return (root, query, cb) -> cb.not(root.get(attribute).in(values));
    }

    public static <T> Specification<T> isTrue(String attribute) {
        return (root, query, cb) -> cb.isTrue(root.get(attribute));
    }

    public static <T> Specification<T> atLeast(String attribute, Integer value) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get(attribute), value);
    }
}
