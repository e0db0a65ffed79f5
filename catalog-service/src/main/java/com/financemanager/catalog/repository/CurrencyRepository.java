package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.dto.currency.CurrencyFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.contains;

@Repository
public interface CurrencyRepository extends BaseRepository<Currency, CurrencyFilter> {

    boolean existsByCharCodeIgnoreCase(String charCode);

    boolean existsByCharCodeIgnoreCaseAndIdNot(String charCode, UUID id);

    boolean existsByNumCodeIgnoreCase(String numCode);

    boolean existsByNumCodeIgnoreCaseAndIdNot(String numCode, UUID id);

    List<Currency> findAllByDeletedFalse(Sort sort);

    @Query("SELECT COUNT(a) FROM Account a WHERE a.currency.id = :currencyId")
    long countAccounts(@Param("currencyId") UUID currencyId);

    @Query("SELECT COUNT(e) FROM ExchangeRate e WHERE e.currency.id = :currencyId")
    long countExchangeRates(@Param("currencyId") UUID currencyId);

    default boolean isCharCodeUnique(String charCode, UUID excludeId) {
        return excludeId == null
                ? !existsByCharCodeIgnoreCase(charCode)
                : !existsByCharCodeIgnoreCaseAndIdNot(charCode, excludeId);
    }

    default boolean isNumCodeUnique(String numCode, UUID excludeId) {
        return excludeId == null
                ? !existsByNumCodeIgnoreCase(numCode)
                : !existsByNumCodeIgnoreCaseAndIdNot(numCode, excludeId);
    }

    /**
     * Referenced by exchange rates or by accounts means in use.
     */
    default boolean canBeDeleted(UUID currencyId) {
        return countExchangeRates(currencyId) == 0 && countAccounts(currencyId) == 0;
    }

    default List<Currency> findAllOrdered(String property, boolean includeDeleted, boolean ascending) {
        Sort sort = ascending ? Sort.by(property).ascending() : Sort.by(property).descending();
        return includeDeleted ? findAll(sort) : findAllByDeletedFalse(sort);
    }

    @Override
    default Specification<Currency> toSpecification(CurrencyFilter filter) {
        return allOf(
                contains("name", filter.getNameContains()),
                contains("charCode", filter.getCharCode()),
                contains("numCode", filter.getNumCode())
        );
    }
}
