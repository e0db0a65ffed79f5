package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.dto.CatalogResponses.AccountTypeResponse;
import com.financemanager.catalog.dto.accounttype.AccountTypeFilter;
import com.financemanager.catalog.dto.accounttype.CreateAccountTypeRequest;
import com.financemanager.catalog.dto.accounttype.UpdateAccountTypeRequest;
import com.financemanager.catalog.errors.AccountTypeErrors;
import com.financemanager.catalog.repository.AccountTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Transactional
public class AccountTypeService {

    private static final Logger log = LoggerFactory.getLogger(AccountTypeService.class);

    private final AccountTypeRepository accountTypeRepository;

    public AccountTypeService(AccountTypeRepository accountTypeRepository) {
        this.accountTypeRepository = accountTypeRepository;
    }

    @Transactional(readOnly = true)
    public AccountTypeResponse getById(UUID id) {
        return accountTypeRepository.findById(id)
                .map(AccountTypeResponse::new)
                .orElseThrow(() -> AccountTypeErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<AccountTypeResponse> getPaged(AccountTypeFilter filter) {
        return accountTypeRepository.getPaged(filter).stream()
                .map(AccountTypeResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AccountTypeResponse> getAll() {
        return accountTypeRepository.findAll(Sort.by("code")).stream()
                .map(AccountTypeResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public boolean existsByCode(String code, boolean includeDeleted) {
        return accountTypeRepository.existsByCode(code, includeDeleted);
    }

    public AccountTypeResponse create(CreateAccountTypeRequest request) {
        if (!StringUtils.hasText(request.getCode())) {
            throw AccountTypeErrors.codeRequired();
        }
        if (!accountTypeRepository.isCodeUnique(request.getCode(), null)) {
            throw AccountTypeErrors.codeExists(request.getCode());
        }

        AccountType accountType = new AccountType(request.getCode(), request.getDescription());
        AccountType saved = accountTypeRepository.save(accountType);
        log.info("Account type created - code={}", request.getCode());
        return new AccountTypeResponse(saved);
    }

    public AccountTypeResponse update(UpdateAccountTypeRequest request) {
        AccountType accountType = accountTypeRepository.findById(request.getId())
                .orElseThrow(() -> AccountTypeErrors.notFound(request.getId()));

        boolean changed = false;

        String code = request.getCode();
        if (code != null && !code.equals(accountType.getCode())) {
            if (!StringUtils.hasText(code)) {
                throw AccountTypeErrors.codeRequired();
            }
            if (!accountTypeRepository.isCodeUnique(code, accountType.getId())) {
                throw AccountTypeErrors.codeExists(code);
            }
            accountType.changeCode(code);
            changed = true;
        }

        String description = request.getDescription();
        if (description != null && !Objects.equals(description, accountType.getDescription())) {
            accountType.changeDescription(description);
            changed = true;
        }

        if (changed) {
            accountType = accountTypeRepository.save(accountType);
            log.info("Account type updated - id={}", request.getId());
        }
        return new AccountTypeResponse(accountType);
    }

    public void softDelete(UUID id) {
        AccountType accountType = accountTypeRepository.findById(id)
                .orElseThrow(() -> AccountTypeErrors.notFound(id));
        if (accountType.markDeleted()) {
            accountTypeRepository.save(accountType);
            log.info("Account type soft deleted - id={}", id);
        }
    }

    public void restore(UUID id) {
        AccountType accountType = accountTypeRepository.findById(id)
                .orElseThrow(() -> AccountTypeErrors.notFound(id));
        if (accountType.restore()) {
            accountTypeRepository.save(accountType);
            log.info("Account type restored - id={}", id);
        }
    }

    public void delete(UUID id) {
        if (!accountTypeRepository.canBeDeleted(id)) {
            throw AccountTypeErrors.inUse(id);
        }
        accountTypeRepository.deleteById(id);
        log.info("Account type deleted - id={}", id);
    }
}
