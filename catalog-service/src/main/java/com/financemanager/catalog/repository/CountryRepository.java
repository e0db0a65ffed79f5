package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.dto.country.CountryFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.contains;

@Repository
public interface CountryRepository extends BaseRepository<Country, CountryFilter> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, UUID id);

    @Query("SELECT COUNT(b) FROM Bank b WHERE b.country.id = :countryId")
    long countBanks(@Param("countryId") UUID countryId);

    default boolean isNameUnique(String name, UUID excludeId) {
        return excludeId == null
                ? !existsByNameIgnoreCase(name)
                : !existsByNameIgnoreCaseAndIdNot(name, excludeId);
    }

    default boolean canBeDeleted(UUID countryId) {
        return countBanks(countryId) == 0;
    }

    @Override
    default Specification<Country> toSpecification(CountryFilter filter) {
        return allOf(contains("name", filter.getNameContains()));
    }
}
