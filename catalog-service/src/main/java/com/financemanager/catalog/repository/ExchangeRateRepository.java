package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.ExchangeRate;
import com.financemanager.catalog.dto.exchangerate.ExchangeRateFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.atLeast;
import static com.financemanager.common.repository.FilterSpecifications.atMost;
import static com.financemanager.common.repository.FilterSpecifications.equalTo;

@Repository
public interface ExchangeRateRepository extends BaseRepository<ExchangeRate, ExchangeRateFilter> {

    boolean existsByCurrencyIdAndRateDate(UUID currencyId, LocalDate rateDate);

    boolean existsByCurrencyIdAndRateDateAndIdNot(UUID currencyId, LocalDate rateDate, UUID id);

    @Query("SELECT MAX(e.rateDate) FROM ExchangeRate e WHERE e.currency.id = :currencyId")
    Optional<LocalDate> findLastRateDate(@Param("currencyId") UUID currencyId);

    /**
     * Removes the currency's rates dated within [dateFrom, dateTo].
     */
    @Modifying
    @Query("DELETE FROM ExchangeRate e WHERE e.currency.id = :currencyId " +
           "AND e.rateDate >= :dateFrom AND e.rateDate <= :dateTo")
    int deleteByPeriod(@Param("currencyId") UUID currencyId,
                       @Param("dateFrom") LocalDate dateFrom,
                       @Param("dateTo") LocalDate dateTo);

    @Override
    default Specification<ExchangeRate> toSpecification(ExchangeRateFilter filter) {
        return allOf(
                equalTo("currency.id", filter.getCurrencyId()),
                atLeast("rateDate", filter.getDateFrom()),
                atMost("rateDate", filter.getDateTo()),
                atLeast("rate", filter.getRateFrom()),
                atMost("rate", filter.getRateTo())
        );
    }
}
