package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.domain.Bank;
import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.dto.CatalogResponses.AccountResponse;
import com.financemanager.catalog.dto.account.AccountFilter;
import com.financemanager.catalog.dto.account.CreateAccountRequest;
import com.financemanager.catalog.dto.account.UpdateAccountRequest;
import com.financemanager.catalog.errors.AccountErrors;
import com.financemanager.catalog.repository.AccountRepository;
import com.financemanager.catalog.repository.AccountTypeRepository;
import com.financemanager.catalog.repository.BankRepository;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for account management.
 *
 * INVARIANTS (per registry holder):
 * - at most one account carries the default flag
 * - the default account is never archived nor soft-deleted
 *
 * Whenever an account becomes default, the holder's previous default is cleared
 * inside the same transaction. Every rule is checked before the first write, so a
 * rejected call leaves nothing behind.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final RegistryHolderRepository registryHolderRepository;
    private final AccountTypeRepository accountTypeRepository;
    private final CurrencyRepository currencyRepository;
    private final BankRepository bankRepository;

    public AccountService(AccountRepository accountRepository,
                          RegistryHolderRepository registryHolderRepository,
                          AccountTypeRepository accountTypeRepository,
                          CurrencyRepository currencyRepository,
                          BankRepository bankRepository) {
        this.accountRepository = accountRepository;
        this.registryHolderRepository = registryHolderRepository;
        this.accountTypeRepository = accountTypeRepository;
        this.currencyRepository = currencyRepository;
        this.bankRepository = bankRepository;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public AccountResponse getById(UUID id) {
        return new AccountResponse(findAccount(id));
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> getPaged(AccountFilter filter) {
        return accountRepository.getPaged(filter).stream()
                .map(AccountResponse::new)
                .collect(Collectors.toList());
    }

    /**
     * @throws com.financemanager.common.error.BusinessException ACCOUNT_DEFAULT_NOT_FOUND if the holder has none
     */
    @Transactional(readOnly = true)
    public AccountResponse getDefault(UUID registryHolderId) {
        return accountRepository.getDefaultAccount(registryHolderId)
                .map(AccountResponse::new)
                .orElseThrow(() -> AccountErrors.defaultNotFound(registryHolderId));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // CREATE / UPDATE
    // ─────────────────────────────────────────────────────────────────────────

    public AccountResponse create(CreateAccountRequest request) {
        if (!StringUtils.hasText(request.getName())) {
            throw AccountErrors.nameRequired();
        }

        RegistryHolder holder = registryHolderRepository.findById(request.getRegistryHolderId())
                .orElseThrow(() -> AccountErrors.registryHolderNotFound(request.getRegistryHolderId()));
        AccountType accountType = usableAccountType(request.getAccountTypeId());
        Currency currency = usableCurrency(request.getCurrencyId());
        Bank bank = request.getBankId() != null ? existingBank(request.getBankId()) : null;

        boolean isDefault = Boolean.TRUE.equals(request.getIsDefault());
        if (isDefault) {
            clearDefault(holder.getId(), null);
        }

        Account account = new Account(holder, accountType, currency, bank, request.getName(),
                Boolean.TRUE.equals(request.getIsIncludeInBalance()), isDefault, request.getCreditLimit());
        account = accountRepository.save(account);
        log.info("Account created - id={}, holder={}, default={}", account.getId(), holder.getId(), isDefault);
        return new AccountResponse(account);
    }

    /**
     * Partial update: null fields are left as they are. Saves only when something changed
     * and always returns the current state.
     */
    public AccountResponse update(UpdateAccountRequest request) {
        Account account = findAccount(request.getId());

        boolean willBeDefault = request.getIsDefault() != null ? request.getIsDefault() : account.isDefaultAccount();
        boolean willBeArchived = request.getIsArchived() != null ? request.getIsArchived() : account.isArchived();
        if (willBeDefault && (willBeArchived || account.isDeleted())) {
            throw AccountErrors.cannotArchiveDefault(account.getId());
        }

        boolean changed = false;

        if (request.getAccountTypeId() != null && !request.getAccountTypeId().equals(account.getAccountType().getId())) {
            account.changeAccountType(usableAccountType(request.getAccountTypeId()));
            changed = true;
        }

        if (request.getCurrencyId() != null && !request.getCurrencyId().equals(account.getCurrency().getId())) {
            account.changeCurrency(usableCurrency(request.getCurrencyId()));
            changed = true;
        }

        if (request.getBankId() != null
                && (account.getBank() == null || !request.getBankId().equals(account.getBank().getId()))) {
            account.changeBank(existingBank(request.getBankId()));
            changed = true;
        }

        if (StringUtils.hasText(request.getName()) && !request.getName().equals(account.getName())) {
            account.rename(request.getName());
            changed = true;
        }

        if (request.getIsIncludeInBalance() != null && request.getIsIncludeInBalance() != account.isIncludeInBalance()) {
            account.changeIncludeInBalance(request.getIsIncludeInBalance());
            changed = true;
        }

        if (request.getIsDefault() != null && request.getIsDefault() != account.isDefaultAccount()) {
            if (request.getIsDefault()) {
                clearDefault(account.getRegistryHolder().getId(), account.getId());
                account.setAsDefault();
            } else {
                account.unsetAsDefault();
            }
            changed = true;
        }

        if (request.getIsArchived() != null && request.getIsArchived() != account.isArchived()) {
            if (request.getIsArchived()) {
                account.archive();
            } else {
                account.unarchive();
            }
            changed = true;
        }

        if (request.getCreditLimit() != null && !sameAmount(request.getCreditLimit(), account.getCreditLimit())) {
            account.changeCreditLimit(request.getCreditLimit());
            changed = true;
        }

        if (changed) {
            account = accountRepository.save(account);
            log.info("Account updated - id={}", account.getId());
        } else {
            log.debug("Account {} unchanged", account.getId());
        }
        return new AccountResponse(account);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // DELETE / RESTORE
    // ─────────────────────────────────────────────────────────────────────────

    public void softDelete(UUID id) {
        Account account = findAccount(id);
        if (account.isDeleted()) {
            return;
        }
        if (account.isDefaultAccount()) {
            throw AccountErrors.cannotSoftDeleteDefault(id);
        }
        account.markDeleted();
        accountRepository.save(account);
    }

    public void restore(UUID id) {
        Account account = findAccount(id);
        if (account.restore()) {
            accountRepository.save(account);
        }
    }

    /**
     * Hard delete. A missing account is not an error.
     */
    public void delete(UUID id) {
        Account account = accountRepository.findById(id).orElse(null);
        if (account == null) {
            return;
        }
        if (account.isDefaultAccount()) {
            throw AccountErrors.cannotDeleteDefault(id);
        }
        accountRepository.delete(account);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // FLAGS
    // ─────────────────────────────────────────────────────────────────────────

    public void archive(UUID id) {
        Account account = findAccount(id);
        if (account.isDefaultAccount()) {
            throw AccountErrors.cannotArchiveDefault(id);
        }
        if (account.isArchived()) {
            return;
        }
        account.archive();
        accountRepository.save(account);
    }

    public void unarchive(UUID id) {
        Account account = findAccount(id);
        if (!account.isArchived()) {
            return;
        }
        account.unarchive();
        accountRepository.save(account);
    }

    /**
     * Make the account its holder's default, clearing the previous default in the same transaction.
     */
    public void setAsDefault(UUID id) {
        Account account = findAccount(id);
        if (account.isDefaultAccount()) {
            return;
        }
        if (!account.canBeDefault()) {
            throw AccountErrors.cannotBeDefaultIfArchivedOrDeleted(id);
        }
        clearDefault(account.getRegistryHolder().getId(), account.getId());
        account.setAsDefault();
        accountRepository.save(account);
    }

    /**
     * Move the default flag from this account to {@code replacementId}.
     */
    public void unsetAsDefault(UUID id, UUID replacementId) {
        Account account = findAccount(id);
        if (!account.isDefaultAccount()) {
            return;
        }

        Account replacement = accountRepository.findById(replacementId)
                .orElseThrow(() -> AccountErrors.replacementNotFound(replacementId));
        if (!replacement.canBeDefault()) {
            throw AccountErrors.replacementCannotBeDefault(replacementId);
        }
        if (!replacement.getRegistryHolder().getId().equals(account.getRegistryHolder().getId())) {
            throw AccountErrors.registryHolderDiffers(id, replacementId);
        }

        account.unsetAsDefault();
        replacement.setAsDefault();
        accountRepository.saveAll(List.of(account, replacement));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // HELPERS
    // ─────────────────────────────────────────────────────────────────────────

    private Account findAccount(UUID id) {
        return accountRepository.findById(id)
                .orElseThrow(() -> AccountErrors.notFound(id));
    }

    private AccountType usableAccountType(UUID accountTypeId) {
        AccountType accountType = accountTypeRepository.findById(accountTypeId)
                .orElseThrow(() -> AccountErrors.accountTypeNotFound(accountTypeId));
        if (accountType.isDeleted()) {
            throw AccountErrors.accountTypeSoftDeleted(accountTypeId);
        }
        return accountType;
    }

    private Currency usableCurrency(UUID currencyId) {
        Currency currency = currencyRepository.findById(currencyId)
                .orElseThrow(() -> AccountErrors.currencyNotFound(currencyId));
        if (currency.isDeleted()) {
            throw AccountErrors.currencySoftDeleted(currencyId);
        }
        return currency;
    }

    private Bank existingBank(UUID bankId) {
        return bankRepository.findById(bankId)
                .orElseThrow(() -> AccountErrors.bankNotFound(bankId));
    }

    /**
     * Clear the default flag on every account of the holder except {@code keepId}.
     */
    private void clearDefault(UUID registryHolderId, UUID keepId) {
        List<Account> previous = accountRepository.findAllByRegistryHolderIdAndDefaultAccountTrue(registryHolderId)
                .stream()
                .filter(a -> keepId == null || !a.getId().equals(keepId))
                .collect(Collectors.toList());
        if (previous.isEmpty()) {
            return;
        }
        previous.forEach(Account::unsetAsDefault);
        accountRepository.saveAll(previous);
        log.debug("Cleared default flag on {} account(s) of holder {}", previous.size(), registryHolderId);
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return b != null && a.compareTo(b) == 0;
    }
}
