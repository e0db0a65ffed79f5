package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.Category;
import com.financemanager.catalog.dto.category.CategoryFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.contains;
import static com.financemanager.common.repository.FilterSpecifications.equalTo;

@Repository
public interface CategoryRepository extends BaseRepository<Category, CategoryFilter> {

    List<Category> findAllByRegistryHolderId(UUID registryHolderId, Sort sort);

    List<Category> findAllByRegistryHolderIdAndNameIgnoreCase(UUID registryHolderId, String name);

    boolean existsByParent_Id(UUID parentId);

    /**
     * Parent id of a category; empty for a top-level or unknown category.
     */
    @Query("SELECT c.parent.id FROM Category c WHERE c.id = :categoryId")
    Optional<UUID> findParentId(@Param("categoryId") UUID categoryId);

    /**
     * Name uniqueness within the (holder, parent) scope, ignoring case.
     * A null parentId is the holder's top level.
     */
    default boolean isNameUniqueInScope(UUID registryHolderId, UUID parentId, String name, UUID excludeId) {
        return findAllByRegistryHolderIdAndNameIgnoreCase(registryHolderId, name).stream()
                .filter(c -> Objects.equals(c.getParentId(), parentId))
                .noneMatch(c -> excludeId == null || !c.getId().equals(excludeId));
    }

    @Override
    default Specification<Category> toSpecification(CategoryFilter filter) {
        return allOf(
                equalTo("registryHolder.id", filter.getRegistryHolderId()),
                contains("name", filter.getNameContains()),
                equalTo("income", filter.getIncome()),
                equalTo("expense", filter.getExpense()),
                equalTo("parent.id", filter.getParentId())
        );
    }
}
