package com.financemanager.transactions.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Replica of a catalog account.
 *
 * Holder, account type and currency are kept as plain ids: replication order makes them
 * present in practice, but no foreign key ties a replica to another replica.
 * Archived or deleted accounts cannot take new transactions or transfers.
 */
@Entity
@Table(
    name = "transactions_accounts",
    indexes = @Index(name = "idx_transactions_accounts_holder_id", columnList = "holder_id")
)
public class TransactionsAccount extends SoftDeletableEntity implements CatalogReplica {

    @Id
    private UUID id;

    @Column(name = "holder_id", nullable = false)
    private UUID holderId;

    @Column(name = "account_type_id", nullable = false)
    private UUID accountTypeId;

    @Column(name = "currency_id", nullable = false)
    private UUID currencyId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "credit_limit", precision = 19, scale = 4)
    private BigDecimal creditLimit;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    protected TransactionsAccount() {
    }

    public TransactionsAccount(UUID id, UUID holderId, UUID accountTypeId, UUID currencyId, String name,
                               BigDecimal creditLimit, boolean archived, boolean deleted) {
        this.id = Objects.requireNonNull(id, "id");
        this.holderId = holderId;
        this.accountTypeId = accountTypeId;
        this.currencyId = currencyId;
        this.name = name;
        this.creditLimit = creditLimit;
        this.archived = archived;
        setDeleted(deleted);
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getHolderId() {
        return holderId;
    }

    public UUID getAccountTypeId() {
        return accountTypeId;
    }

    public UUID getCurrencyId() {
        return currencyId;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getCreditLimit() {
        return creditLimit;
    }

    public boolean isArchived() {
        return archived;
    }

    public boolean refresh(UUID holderId, UUID accountTypeId, UUID currencyId, String name,
                           BigDecimal creditLimit, boolean archived, boolean deleted) {
        boolean sameLimit = creditLimit == null
                ? this.creditLimit == null
                : this.creditLimit != null && this.creditLimit.compareTo(creditLimit) == 0;
        if (Objects.equals(this.holderId, holderId) && Objects.equals(this.accountTypeId, accountTypeId)
                && Objects.equals(this.currencyId, currencyId) && Objects.equals(this.name, name)
                && sameLimit && this.archived == archived && isDeleted() == deleted) {
            return false;
        }
        this.holderId = holderId;
        this.accountTypeId = accountTypeId;
        this.currencyId = currencyId;
        this.name = name;
        this.creditLimit = creditLimit;
        this.archived = archived;
        setDeleted(deleted);
        return true;
    }

    @Override
    public boolean markMissing() {
        return markDeleted();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((TransactionsAccount) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TransactionsAccount{id=" + id + ", name='" + name + "', archived=" + archived +
                ", deleted=" + isDeleted() + '}';
    }
}
