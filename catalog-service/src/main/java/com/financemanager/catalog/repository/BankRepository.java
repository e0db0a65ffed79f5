package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.Bank;
import com.financemanager.catalog.dto.bank.BankFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.contains;
import static com.financemanager.common.repository.FilterSpecifications.equalTo;

@Repository
public interface BankRepository extends BaseRepository<Bank, BankFilter> {

    boolean existsByCountryIdAndNameIgnoreCase(UUID countryId, String name);

    boolean existsByCountryIdAndNameIgnoreCaseAndIdNot(UUID countryId, String name, UUID id);

    /**
     * Accounts at the bank; archived and soft-deleted accounts are counted only on request.
     */
    @Query("SELECT COUNT(a) FROM Account a WHERE a.bank.id = :bankId " +
           "AND (:includeArchived = true OR a.archived = false) " +
           "AND (:includeDeleted = true OR a.deleted = false)")
    long countAccounts(@Param("bankId") UUID bankId,
                       @Param("includeArchived") boolean includeArchived,
                       @Param("includeDeleted") boolean includeDeleted);

    /**
     * Bank names are unique per country, not globally.
     */
    default boolean isNameUniqueByCountry(String name, UUID countryId, UUID excludeId) {
        return excludeId == null
                ? !existsByCountryIdAndNameIgnoreCase(countryId, name)
                : !existsByCountryIdAndNameIgnoreCaseAndIdNot(countryId, name, excludeId);
    }

    default boolean canBeDeleted(UUID bankId) {
        return countAccounts(bankId, true, true) == 0;
    }

    @Override
    default Specification<Bank> toSpecification(BankFilter filter) {
        return allOf(
                equalTo("country.id", filter.getCountryId()),
                contains("name", filter.getNameContains())
        );
    }
}
