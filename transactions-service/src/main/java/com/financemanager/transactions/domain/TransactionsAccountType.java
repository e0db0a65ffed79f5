package com.financemanager.transactions.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "transactions_account_types")
public class TransactionsAccountType extends SoftDeletableEntity implements CatalogReplica {

    @Id
    private UUID id;

    @Column(nullable = false, length = 100)
    private String code;

    @Column(length = 500)
    private String description;

    protected TransactionsAccountType() {
    }

    public TransactionsAccountType(UUID id, String code, String description, boolean deleted) {
        this.id = Objects.requireNonNull(id, "id");
        this.code = code;
        this.description = description;
        setDeleted(deleted);
    }

    @Override
    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean refresh(String code, String description, boolean deleted) {
        if (Objects.equals(this.code, code) && Objects.equals(this.description, description)
                && isDeleted() == deleted) {
            return false;
        }
        this.code = code;
        this.description = description;
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
        return Objects.equals(id, ((TransactionsAccountType) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
