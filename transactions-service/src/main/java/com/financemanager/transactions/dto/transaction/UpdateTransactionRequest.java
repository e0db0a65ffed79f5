package com.financemanager.transactions.dto.transaction;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial update: null fields are left unchanged, except {@code description}, which
 * always replaces the stored one (null clears it).
 */
public class UpdateTransactionRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    private Instant date;
    private UUID accountId;
    private UUID categoryId;
    private BigDecimal amount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    public UpdateTransactionRequest() {
    }

    public UpdateTransactionRequest(UUID id, Instant date, UUID accountId, UUID categoryId,
                                    BigDecimal amount, String description) {
        this.id = id;
        this.date = date;
        this.accountId = accountId;
        this.categoryId = categoryId;
        this.amount = amount;
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
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
