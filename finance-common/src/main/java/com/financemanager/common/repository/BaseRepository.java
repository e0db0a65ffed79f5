package com.financemanager.common.repository;

import com.financemanager.common.dto.PageFilter;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.List;
import java.util.UUID;

/**
 * Generic CRUD repository parameterized by entity and list-filter type.
 *
 * Entity repositories override {@link #toSpecification(PageFilter)} with their own
 * filter predicates; paging, existence and emptiness checks are shared.
 *
 * @param <E> entity type, identified by UUID
 * @param <F> list filter for the entity
 */
@NoRepositoryBean
public interface BaseRepository<E, F extends PageFilter> extends JpaRepository<E, UUID>, JpaSpecificationExecutor<E> {

    /**
     * Filter predicates of the entity. Matches everything unless overridden.
     */
    default Specification<E> toSpecification(F filter) {
        return (root, query, cb) -> cb.conjunction();
    }

    /**
     * One page of entities matching the filter, ordered by creation time.
     */
    default List<E> getPaged(F filter) {
        return findAll(toSpecification(filter), filter.toPageable()).getContent();
    }

    default long countMatching(F filter) {
        return count(toSpecification(filter));
    }

    default boolean any(UUID id) {
        return id != null && existsById(id);
    }

    default boolean isEmpty() {
        return count() == 0;
    }
}
