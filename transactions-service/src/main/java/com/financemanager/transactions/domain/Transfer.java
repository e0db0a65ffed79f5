package com.financemanager.transactions.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Money moved between two accounts, possibly across currencies.
 *
 * fromAmount leaves the source account in its currency, toAmount arrives on the
 * target account in its currency. Neither is ever zero.
 */
@Entity
@Table(
    name = "transfers",
    indexes = {
        @Index(name = "idx_transfers_from_account_id", columnList = "from_account_id"),
        @Index(name = "idx_transfers_to_account_id", columnList = "to_account_id"),
        @Index(name = "idx_transfers_date", columnList = "transfer_date")
    }
)
public class Transfer extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "from_account_id", nullable = false)
    private TransactionsAccount fromAccount;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "to_account_id", nullable = false)
    private TransactionsAccount toAccount;

    @Column(name = "from_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal fromAmount;

    @Column(name = "to_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal toAmount;

    @Column(name = "transfer_date", nullable = false)
    private Instant date;

    @Column(length = 1000)
    private String description;

    protected Transfer() {
    }

    public Transfer(TransactionsAccount fromAccount, TransactionsAccount toAccount,
                    BigDecimal fromAmount, BigDecimal toAmount, Instant date, String description) {
        this.fromAccount = Objects.requireNonNull(fromAccount, "fromAccount");
        this.toAccount = Objects.requireNonNull(toAccount, "toAccount");
        this.fromAmount = Objects.requireNonNull(fromAmount, "fromAmount");
        this.toAmount = Objects.requireNonNull(toAmount, "toAmount");
        this.date = Objects.requireNonNull(date, "date");
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public TransactionsAccount getFromAccount() {
        return fromAccount;
    }

    public TransactionsAccount getToAccount() {
        return toAccount;
    }

    public BigDecimal getFromAmount() {
        return fromAmount;
    }

    public BigDecimal getToAmount() {
        return toAmount;
    }

    public Instant getDate() {
        return date;
    }

    public String getDescription() {
        return description;
    }

    public void changeFromAccount(TransactionsAccount fromAccount) {
        this.fromAccount = Objects.requireNonNull(fromAccount, "fromAccount");
    }

    public void changeToAccount(TransactionsAccount toAccount) {
        this.toAccount = Objects.requireNonNull(toAccount, "toAccount");
    }

    public void changeFromAmount(BigDecimal fromAmount) {
        this.fromAmount = Objects.requireNonNull(fromAmount, "fromAmount");
    }

    public void changeToAmount(BigDecimal toAmount) {
        this.toAmount = Objects.requireNonNull(toAmount, "toAmount");
    }

    public void changeDate(Instant date) {
        this.date = Objects.requireNonNull(date, "date");
    }

    public void changeDescription(String description) {
        this.description = description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transfer that = (Transfer) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Transfer{id=" + id + ", fromAmount=" + fromAmount + ", toAmount=" + toAmount + '}';
    }
}
