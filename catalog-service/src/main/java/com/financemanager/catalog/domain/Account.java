package com.financemanager.catalog.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Account owned by a registry holder.
 *
 * Invariants (enforced by AccountService, which sees all accounts of a holder):
 * - at most one account per holder is default
 * - a default account is never archived nor deleted
 *
 * The flag methods only flip state; they do not check those rules.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_registry_holder_id", columnList = "registry_holder_id"),
        @Index(name = "idx_accounts_account_type_id", columnList = "account_type_id"),
        @Index(name = "idx_accounts_currency_id", columnList = "currency_id"),
        @Index(name = "idx_accounts_bank_id", columnList = "bank_id")
    }
)
public class Account extends SoftDeletableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "registry_holder_id", nullable = false)
    private RegistryHolder registryHolder;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_type_id", nullable = false)
    private AccountType accountType;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "currency_id", nullable = false)
    private Currency currency;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "bank_id")
    private Bank bank;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "is_include_in_balance", nullable = false)
    private boolean includeInBalance;

    @Column(name = "is_default", nullable = false)
    private boolean defaultAccount;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    /**
     * Optional; null means no credit line.
     */
    @Column(name = "credit_limit", precision = 19, scale = 4)
    private BigDecimal creditLimit;

    protected Account() {
    }

    public Account(RegistryHolder registryHolder,
                   AccountType accountType,
                   Currency currency,
                   Bank bank,
                   String name,
                   boolean includeInBalance,
                   boolean defaultAccount,
                   BigDecimal creditLimit) {
        this.registryHolder = Objects.requireNonNull(registryHolder, "registryHolder");
        this.accountType = Objects.requireNonNull(accountType, "accountType");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.bank = bank;
        this.name = name;
        this.includeInBalance = includeInBalance;
        this.defaultAccount = defaultAccount;
        this.archived = false;
        this.creditLimit = creditLimit;
    }

    public UUID getId() {
        return id;
    }

    public RegistryHolder getRegistryHolder() {
        return registryHolder;
    }

    public AccountType getAccountType() {
        return accountType;
    }

    public Currency getCurrency() {
        return currency;
    }

    public Bank getBank() {
        return bank;
    }

    public String getName() {
        return name;
    }

    public boolean isIncludeInBalance() {
        return includeInBalance;
    }

    public boolean isDefaultAccount() {
        return defaultAccount;
    }

    public boolean isArchived() {
        return archived;
    }

    public BigDecimal getCreditLimit() {
        return creditLimit;
    }

    // Business methods

    public void setAsDefault() {
        this.defaultAccount = true;
    }

    public void unsetAsDefault() {
        this.defaultAccount = false;
    }

    public void archive() {
        this.archived = true;
    }

    public void unarchive() {
        this.archived = false;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeAccountType(AccountType accountType) {
        this.accountType = Objects.requireNonNull(accountType, "accountType");
    }

    public void changeCurrency(Currency currency) {
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public void changeBank(Bank bank) {
        this.bank = bank;
    }

    public void changeIncludeInBalance(boolean includeInBalance) {
        this.includeInBalance = includeInBalance;
    }

    public void changeCreditLimit(BigDecimal creditLimit) {
        this.creditLimit = creditLimit;
    }

    /**
     * True when this account can hold the default flag.
     */
    public boolean canBeDefault() {
        return !archived && !isDeleted();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return id != null && Objects.equals(id, account.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", default=" + defaultAccount +
                ", archived=" + archived +
                ", deleted=" + isDeleted() +
                '}';
    }
}
