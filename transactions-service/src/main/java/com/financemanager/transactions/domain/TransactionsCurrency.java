package com.financemanager.transactions.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "transactions_currencies")
public class TransactionsCurrency extends SoftDeletableEntity implements CatalogReplica {

    @Id
    private UUID id;

    @Column(name = "char_code", nullable = false, length = 10)
    private String charCode;

    @Column(name = "num_code", nullable = false, length = 10)
    private String numCode;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 10)
    private String sign;

    protected TransactionsCurrency() {
    }

    public TransactionsCurrency(UUID id, String charCode, String numCode, String name, String sign, boolean deleted) {
        this.id = Objects.requireNonNull(id, "id");
        this.charCode = charCode;
        this.numCode = numCode;
        this.name = name;
        this.sign = sign;
        setDeleted(deleted);
    }

    @Override
    public UUID getId() {
        return id;
    }

    public String getCharCode() {
        return charCode;
    }

    public String getNumCode() {
        return numCode;
    }

    public String getName() {
        return name;
    }

    public String getSign() {
        return sign;
    }

    public boolean refresh(String charCode, String numCode, String name, String sign, boolean deleted) {
        if (Objects.equals(this.charCode, charCode) && Objects.equals(this.numCode, numCode)
                && Objects.equals(this.name, name) && Objects.equals(this.sign, sign)
                && isDeleted() == deleted) {
            return false;
        }
        this.charCode = charCode;
        this.numCode = numCode;
        this.name = name;
        this.sign = sign;
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
        return Objects.equals(id, ((TransactionsCurrency) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
