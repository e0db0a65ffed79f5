package com.financemanager.transactions.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Replica of a catalog category. The parent is kept as an id only.
 *
 * Catalog categories are hard deleted; here a category that disappeared from the
 * catalog is marked deleted so that existing transactions keep their reference.
 */
@Entity
@Table(
    name = "transactions_categories",
    indexes = @Index(name = "idx_transactions_categories_holder_id", columnList = "holder_id")
)
public class TransactionsCategory extends SoftDeletableEntity implements CatalogReplica {

    @Id
    private UUID id;

    @Column(name = "holder_id", nullable = false)
    private UUID holderId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false)
    private boolean income;

    @Column(nullable = false)
    private boolean expense;

    @Column(name = "parent_id")
    private UUID parentId;

    protected TransactionsCategory() {
    }

    public TransactionsCategory(UUID id, UUID holderId, String name, boolean income, boolean expense, UUID parentId) {
        this.id = Objects.requireNonNull(id, "id");
        this.holderId = holderId;
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.parentId = parentId;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getHolderId() {
        return holderId;
    }

    public String getName() {
        return name;
    }

    public boolean isIncome() {
        return income;
    }

    public boolean isExpense() {
        return expense;
    }

    public UUID getParentId() {
        return parentId;
    }

    /**
     * A category present in the catalog is live again, even if it was marked missing before.
     */
    public boolean refresh(UUID holderId, String name, boolean income, boolean expense, UUID parentId) {
        if (Objects.equals(this.holderId, holderId) && Objects.equals(this.name, name)
                && this.income == income && this.expense == expense
                && Objects.equals(this.parentId, parentId) && !isDeleted()) {
            return false;
        }
        this.holderId = holderId;
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.parentId = parentId;
        restore();
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
        return Objects.equals(id, ((TransactionsCategory) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
