package com.financemanager.transactions.dto;

import com.financemanager.transactions.domain.Transaction;
import com.financemanager.transactions.domain.Transfer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTOs of the transactions API.
 */
public class TransactionsResponses {

    public static class TransactionResponse {
        private UUID id;
        private Instant date;
        private UUID accountId;
        private UUID categoryId;
        private BigDecimal amount;
        private String description;

        public TransactionResponse(Transaction transaction) {
            this.id = transaction.getId();
            this.date = transaction.getDate();
            this.accountId = transaction.getAccount().getId();
            this.categoryId = transaction.getCategory().getId();
            this.amount = transaction.getAmount();
            this.description = transaction.getDescription();
        }

        public UUID getId() { return id; }
        public Instant getDate() { return date; }
        public UUID getAccountId() { return accountId; }
        public UUID getCategoryId() { return categoryId; }
        public BigDecimal getAmount() { return amount; }
        public String getDescription() { return description; }
    }

    public static class TransferResponse {
        private UUID id;
        private Instant date;
        private UUID fromAccountId;
        private UUID toAccountId;
        private BigDecimal fromAmount;
        private BigDecimal toAmount;
        private String description;

        public TransferResponse(Transfer transfer) {
            this.id = transfer.getId();
            this.date = transfer.getDate();
            this.fromAccountId = transfer.getFromAccount().getId();
            this.toAccountId = transfer.getToAccount().getId();
            this.fromAmount = transfer.getFromAmount();
            this.toAmount = transfer.getToAmount();
            this.description = transfer.getDescription();
        }

        public UUID getId() { return id; }
        public Instant getDate() { return date; }
        public UUID getFromAccountId() { return fromAccountId; }
        public UUID getToAccountId() { return toAccountId; }
        public BigDecimal getFromAmount() { return fromAmount; }
        public BigDecimal getToAmount() { return toAmount; }
        public String getDescription() { return description; }
    }

    public static class CountResponse {
        private long count;

        public CountResponse(long count) {
            this.count = count;
        }

        public long getCount() { return count; }
    }
}
