package com.financemanager.transactions.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Income or expense on one account.
 *
 * The sign of the amount gives the direction; zero is never a valid amount
 * (enforced by TransactionService).
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_account_id", columnList = "account_id"),
        @Index(name = "idx_transactions_category_id", columnList = "category_id"),
        @Index(name = "idx_transactions_date", columnList = "transaction_date")
    }
)
public class Transaction extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private TransactionsAccount account;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private TransactionsCategory category;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "transaction_date", nullable = false)
    private Instant date;

    @Column(length = 1000)
    private String description;

    protected Transaction() {
    }

    public Transaction(TransactionsAccount account, TransactionsCategory category, BigDecimal amount,
                       Instant date, String description) {
        this.account = Objects.requireNonNull(account, "account");
        this.category = Objects.requireNonNull(category, "category");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.date = Objects.requireNonNull(date, "date");
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public TransactionsAccount getAccount() {
        return account;
    }

    public TransactionsCategory getCategory() {
        return category;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Instant getDate() {
        return date;
    }

    public String getDescription() {
        return description;
    }

    public void changeAccount(TransactionsAccount account) {
        this.account = Objects.requireNonNull(account, "account");
    }

    public void changeCategory(TransactionsCategory category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    public void changeAmount(BigDecimal amount) {
        this.amount = Objects.requireNonNull(amount, "amount");
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
        Transaction that = (Transaction) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Transaction{id=" + id + ", amount=" + amount + ", date=" + date + '}';
    }
}
