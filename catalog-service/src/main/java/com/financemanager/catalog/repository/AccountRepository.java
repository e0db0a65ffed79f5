package com.financemanager.catalog.repository;

import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.dto.account.AccountFilter;
import com.financemanager.common.repository.BaseRepository;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.financemanager.common.repository.FilterSpecifications.allOf;
import static com.financemanager.common.repository.FilterSpecifications.atLeast;
import static com.financemanager.common.repository.FilterSpecifications.atMost;
import static com.financemanager.common.repository.FilterSpecifications.contains;
import static com.financemanager.common.repository.FilterSpecifications.equalTo;

/**
 * Repository for accounts.
 *
 * Default-account lookups back the one-default-per-holder rule: AccountService reads
 * the current default with {@link #findAllByRegistryHolderIdAndDefaultAccountTrue(UUID)}
 * and clears it in the same transaction that sets the new one. There is no row lock;
 * two concurrent requests for the same holder can still both set a default.
 */
@Repository
public interface AccountRepository extends BaseRepository<Account, AccountFilter> {

    Optional<Account> findFirstByRegistryHolderIdAndDefaultAccountTrue(UUID registryHolderId);

    List<Account> findAllByRegistryHolderIdAndDefaultAccountTrue(UUID registryHolderId);

    default Optional<Account> getDefaultAccount(UUID registryHolderId) {
        return findFirstByRegistryHolderIdAndDefaultAccountTrue(registryHolderId);
    }

    @Override
    default Specification<Account> toSpecification(AccountFilter filter) {
        return allOf(
                equalTo("registryHolder.id", filter.getRegistryHolderId()),
                equalTo("accountType.id", filter.getAccountTypeId()),
                equalTo("currency.id", filter.getCurrencyId()),
                equalTo("bank.id", filter.getBankId()),
                contains("name", filter.getNameContains()),
                equalTo("includeInBalance", filter.getIsIncludeInBalance()),
                equalTo("defaultAccount", filter.getIsDefault()),
                equalTo("archived", filter.getIsArchived()),
                atLeast("creditLimit", filter.getCreditLimitFrom()),
                atMost("creditLimit", filter.getCreditLimitTo())
        );
    }
}
