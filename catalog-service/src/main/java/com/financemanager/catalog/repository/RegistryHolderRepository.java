package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.dto.registryholder.RegistryHolderFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.equalTo;

@Repository
public interface RegistryHolderRepository extends BaseRepository<RegistryHolder, RegistryHolderFilter> {

    boolean existsByTelegramId(long telegramId);

    boolean existsByTelegramIdAndIdNot(long telegramId, UUID id);

    @Query("SELECT COUNT(c) FROM Category c WHERE c.registryHolder.id = :holderId")
    long countCategories(@Param("holderId") UUID holderId);

    @Query("SELECT COUNT(a) FROM Account a WHERE a.registryHolder.id = :holderId")
    long countAccounts(@Param("holderId") UUID holderId);

    /**
     * @param excludeId holder being updated, or null on create
     */
    default boolean isTelegramIdUnique(long telegramId, UUID excludeId) {
        return excludeId == null
                ? !existsByTelegramId(telegramId)
                : !existsByTelegramIdAndIdNot(telegramId, excludeId);
    }

    /**
     * A holder that owns categories or accounts (including archived and soft-deleted
     * ones) cannot be removed.
     */
    default boolean canBeDeleted(UUID holderId) {
        return countCategories(holderId) == 0 && countAccounts(holderId) == 0;
    }

    @Override
    default Specification<RegistryHolder> toSpecification(RegistryHolderFilter filter) {
        return allOf(
                equalTo("telegramId", filter.getTelegramId()),
                equalTo("role", filter.getRole())
        );
    }
}
