package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Bank;
import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.dto.CatalogResponses.BankResponse;
import com.financemanager.catalog.dto.bank.BankFilter;
import com.financemanager.catalog.dto.bank.CreateBankRequest;
import com.financemanager.catalog.dto.bank.UpdateBankRequest;
import com.financemanager.catalog.errors.BankErrors;
import com.financemanager.catalog.repository.BankRepository;
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

/**
 * Banks belong to a country; a bank name is unique within its country.
 */
@Service
@Transactional
public class BankService {

    private static final Logger log = LoggerFactory.getLogger(BankService.class);

    private final BankRepository bankRepository;
    private final CountryRepository countryRepository;

    public BankService(BankRepository bankRepository, CountryRepository countryRepository) {
        this.bankRepository = bankRepository;
        this.countryRepository = countryRepository;
    }

    @Transactional(readOnly = true)
    public BankResponse getById(UUID id) {
        return bankRepository.findById(id)
                .map(BankResponse::new)
                .orElseThrow(() -> BankErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<BankResponse> getPaged(BankFilter filter) {
        return bankRepository.getPaged(filter).stream()
                .map(BankResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<BankResponse> getAll() {
        return bankRepository.findAll(Sort.by("name")).stream()
                .map(BankResponse::new)
                .collect(Collectors.toList());
    }

    /**
     * Count the accounts opened in a bank.
     *
     * @param includeArchived count archived accounts too
     * @param includeDeleted  count soft-deleted accounts too
     */
    @Transactional(readOnly = true)
    public long getAccountsCount(UUID bankId, boolean includeArchived, boolean includeDeleted) {
        if (!bankRepository.any(bankId)) {
            throw BankErrors.notFound(bankId);
        }
        return bankRepository.countAccounts(bankId, includeArchived, includeDeleted);
    }

    public BankResponse create(CreateBankRequest request) {
        String name = request.getName();
        if (!StringUtils.hasText(name)) {
            throw BankErrors.nameRequired();
        }
        Country country = countryRepository.findById(request.getCountryId())
                .orElseThrow(() -> BankErrors.countryNotFound(request.getCountryId()));
        if (!bankRepository.isNameUniqueByCountry(name, country.getId(), null)) {
            throw BankErrors.nameExists(name);
        }
        Bank bank = bankRepository.save(new Bank(country, name));
        log.info("Bank created - name={}, country={}", name, country.getId());
        return new BankResponse(bank);
    }

    public BankResponse update(UpdateBankRequest request) {
        Bank bank = bankRepository.findById(request.getId())
                .orElseThrow(() -> BankErrors.notFound(request.getId()));

        boolean changed = false;

        if (request.getCountryId() != null && !request.getCountryId().equals(bank.getCountry().getId())) {
            Country country = countryRepository.findById(request.getCountryId())
                    .orElseThrow(() -> BankErrors.countryNotFound(request.getCountryId()));
            bank.moveTo(country);
            changed = true;
        }

        String name = request.getName();
        if (name != null && !name.equals(bank.getName())) {
            if (!StringUtils.hasText(name)) {
                throw BankErrors.nameRequired();
            }
            bank.rename(name);
            changed = true;
        }

        // uniqueness is checked against the resulting country
        if (changed && !bankRepository.isNameUniqueByCountry(bank.getName(), bank.getCountry().getId(), bank.getId())) {
            throw BankErrors.nameExists(bank.getName());
        }

        if (changed) {
            bank = bankRepository.save(bank);
            log.info("Bank updated - id={}", request.getId());
        }
        return new BankResponse(bank);
    }

    public void delete(UUID id) {
        if (!bankRepository.canBeDeleted(id)) {
            throw BankErrors.inUse(id);
        }
        bankRepository.deleteById(id);
        log.info("Bank deleted - id={}", id);
    }
}
