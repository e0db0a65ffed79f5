package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.dto.accounttype.AccountTypeFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.contains;

@Repository
public interface AccountTypeRepository extends BaseRepository<AccountType, AccountTypeFilter> {

    boolean existsByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCaseAndIdNot(String code, UUID id);

    boolean existsByCode(String code);

    boolean existsByCodeAndDeletedFalse(String code);

    @Query("SELECT COUNT(a) FROM Account a WHERE a.accountType.id = :accountTypeId")
    long countAccounts(@Param("accountTypeId") UUID accountTypeId);

    default boolean isCodeUnique(String code, UUID excludeId) {
        return excludeId == null
                ? !existsByCodeIgnoreCase(code)
                : !existsByCodeIgnoreCaseAndIdNot(code, excludeId);
    }

    default boolean existsByCode(String code, boolean includeDeleted) {
        return includeDeleted ? existsByCode(code) : existsByCodeAndDeletedFalse(code);
    }

    default boolean canBeDeleted(UUID accountTypeId) {
        return countAccounts(accountTypeId) == 0;
    }

    @Override
    default Specification<AccountType> toSpecification(AccountTypeFilter filter) {
        return allOf(
                contains("code", filter.getCode()),
                contains("description", filter.getDescriptionContains())
        );
    }
}
