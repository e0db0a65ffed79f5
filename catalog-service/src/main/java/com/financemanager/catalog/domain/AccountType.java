package com.financemanager.catalog.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Kind of account (cash, debit card, deposit, ...), keyed by a short code.
 */
@Entity
@Table(
    name = "account_types",
    indexes = {
        @Index(name = "idx_account_types_code", columnList = "code")
    }
)
public class AccountType extends SoftDeletableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String code;

    @Column(length = 500)
    private String description;

    protected AccountType() {
    }

    public AccountType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public void changeCode(String code) {
        this.code = code;
    }

    public void changeDescription(String description) {
        this.description = description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccountType that = (AccountType) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AccountType{id=" + id + ", code='" + code + "', deleted=" + isDeleted() + '}';
    }
}
