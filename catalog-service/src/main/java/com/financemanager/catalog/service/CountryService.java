package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.dto.CatalogResponses.CountryResponse;
import com.financemanager.catalog.dto.country.CountryFilter;
import com.financemanager.catalog.dto.country.CreateCountryRequest;
import com.financemanager.catalog.dto.country.UpdateCountryRequest;
import com.financemanager.catalog.errors.CountryErrors;
import com.financemanager.catalog.repository.CountryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Transactional
public class CountryService {

    private static final Logger log = LoggerFactory.getLogger(CountryService.class);

    private final CountryRepository countryRepository;

    public CountryService(CountryRepository countryRepository) {
        this.countryRepository = countryRepository;
    }

    @Transactional(readOnly = true)
    public CountryResponse getById(UUID id) {
        return countryRepository.findById(id)
                .map(CountryResponse::new)
                .orElseThrow(() -> CountryErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<CountryResponse> getPaged(CountryFilter filter) {
        return countryRepository.getPaged(filter).stream()
                .map(CountryResponse::new)
                .collect(Collectors.toList());
    }

    /** All countries ordered by name. */
    @Transactional(readOnly = true)
    public List<CountryResponse> getAll() {
        return countryRepository.findAll(Sort.by("name")).stream()
                .map(CountryResponse::new)
                .collect(Collectors.toList());
    }

    public CountryResponse create(CreateCountryRequest request) {
        String name = request.getName();
        if (!StringUtils.hasText(name)) {
            throw CountryErrors.nameRequired();
        }
        if (!countryRepository.isNameUnique(name, null)) {
            throw CountryErrors.nameExists(name);
        }
        Country country = countryRepository.save(new Country(name));
        log.info("Country created - name={}", name);
        return new CountryResponse(country);
    }

    public CountryResponse update(UpdateCountryRequest request) {
        Country country = countryRepository.findById(request.getId())
                .orElseThrow(() -> CountryErrors.notFound(request.getId()));

        String name = request.getName();
        if (name != null && !name.equals(country.getName())) {
            if (!StringUtils.hasText(name)) {
                throw CountryErrors.nameRequired();
            }
            if (!countryRepository.isNameUnique(name, country.getId())) {
                throw CountryErrors.nameExists(name);
            }
            country.rename(name);
            country = countryRepository.save(country);
            log.info("Country renamed - id={}, name={}", request.getId(), name);
        }
        return new CountryResponse(country);
    }

    public void delete(UUID id) {
        if (!countryRepository.canBeDeleted(id)) {
            log.debug("Country {} still has banks", id);
            throw CountryErrors.inUse(id);
        }
        countryRepository.deleteById(id);
        log.info("Country deleted - id={}", id);
    }
}
