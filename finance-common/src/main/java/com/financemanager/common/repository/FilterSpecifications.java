package com.financemanager.common.repository;

import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

/**
 * Null-tolerant building blocks for list filters.
 *
 * Every factory returns {@code null} for an absent filter value; {@link Specification#and}
 * ignores null operands, so optional filter fields compose without branching.
 * Attribute names may be dotted paths ({@code "registryHolder.id"}).
 */
public final class FilterSpecifications {

    private FilterSpecifications() {
    }

    /**
     * AND of all non-null parts; matches everything when every part is null.
     */
    @SafeVarargs
    public static <E> Specification<E> allOf(Specification<E>... parts) {
        Specification<E> result = (root, query, cb) -> cb.conjunction();
        for (Specification<E> part : parts) {
            if (part != null) {
                result = result.and(part);
            }
        }
        return result;
    }

    public static <E> Specification<E> equalTo(String attribute, Object value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(path(root, attribute), value);
    }

    /**
     * Case-insensitive substring match. An empty string matches only empty values.
     */
    public static <E> Specification<E> contains(String attribute, String text) {
        if (text == null) {
            return null;
        }
        if (text.isEmpty()) {
            return (root, query, cb) -> cb.equal(path(root, attribute), "");
        }
        String pattern = "%" + escapeLike(text.toLowerCase()) + "%";
        return (root, query, cb) -> cb.like(cb.lower(path(root, attribute)), pattern, '\\');
    }

    public static <E, C extends Comparable<? super C>> Specification<E> atLeast(String attribute, C value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(path(root, attribute), value);
    }

    public static <E, C extends Comparable<? super C>> Specification<E> atMost(String attribute, C value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(path(root, attribute), value);
    }

    private static <T> Path<T> path(Root<?> root, String attribute) {
        Path<?> path = root;
        for (String part : attribute.split("\\.")) {
            path = path.get(part);
        }
        @SuppressWarnings("unchecked")
        Path<T> typed = (Path<T>) path;
        return typed;
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
