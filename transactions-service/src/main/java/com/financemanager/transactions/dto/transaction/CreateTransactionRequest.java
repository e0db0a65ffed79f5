package com.financemanager.transactions.dto.transaction;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public class CreateTransactionRequest {

    @NotNull(message = "Date is required")
    private Instant date;

    @NotNull(message = "Account id is required")
    private UUID accountId;

    @NotNull(message = "Category id is required")
    private UUID categoryId;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    public CreateTransactionRequest() {
    }

    public CreateTransactionRequest(Instant date, UUID accountId, UUID categoryId, BigDecimal amount,
                                    String description) {
        this.date = date;
        this.accountId = accountId;
        this.categoryId = categoryId;
        this.amount = amount;
        this.description = description;
    }

    public Instant getDate() {
        return date;
    }

    public void setDate(Instant date) {
        this.date = date;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public void setAccountId(UUID accountId) {
        this.accountId = accountId;
    }

    public UUID getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(UUID categoryId) {
        this.categoryId = categoryId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
