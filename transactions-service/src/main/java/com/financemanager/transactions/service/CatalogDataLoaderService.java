package com.financemanager.transactions.service;

import com.financemanager.transactions.client.CatalogApiClient;
import com.financemanager.transactions.client.CatalogResource;
import com.financemanager.transactions.client.dto.*;
import com.financemanager.transactions.domain.*;
import com.financemanager.transactions.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Replicates catalog collections into the local replica tables.
 *
 * REPLICATION RULES (per collection, one transaction each):
 * 1. Fetch the whole collection from the catalog
 * 2. Insert records with no local replica; overwrite the fields of existing replicas in place
 * 3. Mark replicas missing from the collection as deleted (soft-deletable kinds only)
 * 4. Save everything that changed in one batch, after the full collection is processed
 *
 * A fetch failure ({@link com.financemanager.transactions.client.ExternalApiException})
 * propagates before anything is saved.
 */
@Service
public class CatalogDataLoaderService {

    private static final Logger log = LoggerFactory.getLogger(CatalogDataLoaderService.class);

    private final CatalogApiClient catalogApiClient;
    private final TransactionHolderRepository holderRepository;
    private final TransactionsAccountTypeRepository accountTypeRepository;
    private final TransactionsCurrencyRepository currencyRepository;
    private final TransactionsAccountRepository accountRepository;
    private final TransactionsCategoryRepository categoryRepository;

    public CatalogDataLoaderService(CatalogApiClient catalogApiClient,
                                    TransactionHolderRepository holderRepository,
                                    TransactionsAccountTypeRepository accountTypeRepository,
                                    TransactionsCurrencyRepository currencyRepository,
                                    TransactionsAccountRepository accountRepository,
                                    TransactionsCategoryRepository categoryRepository) {
        this.catalogApiClient = catalogApiClient;
        this.holderRepository = holderRepository;
        this.accountTypeRepository = accountTypeRepository;
        this.currencyRepository = currencyRepository;
        this.accountRepository = accountRepository;
        this.categoryRepository = categoryRepository;
    }

    @Transactional
    public SyncResult load(CatalogResource resource) {
        switch (resource) {
            case REGISTRY_HOLDERS:
                return loadRegistryHolders();
            case ACCOUNT_TYPES:
                return loadAccountTypes();
            case CURRENCIES:
                return loadCurrencies();
            case ACCOUNTS:
                return loadAccounts();
            case CATEGORIES:
                return loadCategories();
            default:
                throw new IllegalArgumentException("Unsupported catalog resource: " + resource);
        }
    }

    @Transactional
    public SyncResult loadRegistryHolders() {
        return replicate(CatalogResource.REGISTRY_HOLDERS, catalogApiClient.getAllRegistryHolders(),
                holderRepository, CatalogRegistryHolder::getId,
                r -> new TransactionHolder(r.getId(), r.getTelegramId(), r.getRole()),
                (h, r) -> h.refresh(r.getTelegramId(), r.getRole()));
    }

    @Transactional
    public SyncResult loadAccountTypes() {
        return replicate(CatalogResource.ACCOUNT_TYPES, catalogApiClient.getAllAccountTypes(),
                accountTypeRepository, CatalogAccountType::getId,
                r -> new TransactionsAccountType(r.getId(), r.getCode(), r.getDescription(), r.getIsDeleted()),
                (t, r) -> t.refresh(r.getCode(), r.getDescription(), r.getIsDeleted()));
    }

    @Transactional
    public SyncResult loadCurrencies() {
        return replicate(CatalogResource.CURRENCIES, catalogApiClient.getAllCurrencies(),
                currencyRepository, CatalogCurrency::getId,
                r -> new TransactionsCurrency(r.getId(), r.getCharCode(), r.getNumCode(), r.getName(), r.getSign(),
                        r.getIsDeleted()),
                (c, r) -> c.refresh(r.getCharCode(), r.getNumCode(), r.getName(), r.getSign(), r.getIsDeleted()));
    }

    @Transactional
    public SyncResult loadAccounts() {
        return replicate(CatalogResource.ACCOUNTS, catalogApiClient.getAllAccounts(),
                accountRepository, CatalogAccount::getId,
                r -> new TransactionsAccount(r.getId(), idOf(r.getRegistryHolder()), idOf(r.getAccountType()),
                        idOf(r.getCurrency()), r.getName(), r.getCreditLimit(), r.getIsArchived(), r.getIsDeleted()),
                (a, r) -> a.refresh(idOf(r.getRegistryHolder()), idOf(r.getAccountType()), idOf(r.getCurrency()),
                        r.getName(), r.getCreditLimit(), r.getIsArchived(), r.getIsDeleted()));
    }

    @Transactional
    public SyncResult loadCategories() {
        return replicate(CatalogResource.CATEGORIES, catalogApiClient.getAllCategories(),
                categoryRepository, CatalogCategory::getId,
                r -> new TransactionsCategory(r.getId(), idOf(r.getRegistryHolder()), r.getName(),
                        r.getIncome(), r.getExpense(), r.getParentId()),
                (c, r) -> c.refresh(idOf(r.getRegistryHolder()), r.getName(), r.getIncome(), r.getExpense(),
                        r.getParentId()));
    }

    private <R, E extends CatalogReplica> SyncResult replicate(CatalogResource resource,
                                                               List<R> records,
                                                               JpaRepository<E, UUID> repository,
                                                               Function<R, UUID> recordId,
                                                               Function<R, E> creator,
                                                               BiPredicate<E, R> updater) {
        Map<UUID, E> existing = new HashMap<>();
        for (E replica : repository.findAll()) {
            existing.put(replica.getId(), replica);
        }

        List<E> changed = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        int inserted = 0;
        int updated = 0;

        for (R record : records) {
            UUID id = recordId.apply(record);
            if (id == null || !seen.add(id)) {
                log.warn("Skipping {} record without id or listed twice: {}", resource, id);
                continue;
            }
            E replica = existing.get(id);
            if (replica == null) {
                changed.add(creator.apply(record));
                inserted++;
            } else if (updater.test(replica, record)) {
                changed.add(replica);
                updated++;
            }
        }

        int deleted = 0;
        for (E replica : existing.values()) {
            if (!seen.contains(replica.getId()) && replica.markMissing()) {
                changed.add(replica);
                deleted++;
            }
        }

        if (!changed.isEmpty()) {
            repository.saveAll(changed);
        }
        SyncResult result = new SyncResult(records.size(), inserted, updated, deleted);
        log.info("Catalog {} replicated - {}", resource, result);
        return result;
    }

    private static UUID idOf(CatalogReference reference) {
        return reference != null ? reference.getId() : null;
    }
}
