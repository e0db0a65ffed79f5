package com.financemanager.transactions.dto.transfer;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public class CreateTransferRequest {

    @NotNull(message = "Date is required")
    private Instant date;

    @NotNull(message = "Source account id is required")
    private UUID fromAccountId;

    @NotNull(message = "Target account id is required")
    private UUID toAccountId;

    @NotNull(message = "Source amount is required")
    private BigDecimal fromAmount;

    @NotNull(message = "Target amount is required")
    private BigDecimal toAmount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    public CreateTransferRequest() {
    }

    public CreateTransferRequest(Instant date, UUID fromAccountId, UUID toAccountId,
                                 BigDecimal fromAmount, BigDecimal toAmount, String description) {
        this.date = date;
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.fromAmount = fromAmount;
        this.toAmount = toAmount;
        this.description = description;
    }

    public Instant getDate() {
        return date;
    }

    public void setDate(Instant date) {
        this.date = date;
    }

    public UUID getFromAccountId() {
        return fromAccountId;
    }

    public void setFromAccountId(UUID fromAccountId) {
        this.fromAccountId = fromAccountId;
    }

    public UUID getToAccountId() {
        return toAccountId;
    }

    public void setToAccountId(UUID toAccountId) {
        this.toAccountId = toAccountId;
    }

    public BigDecimal getFromAmount() {
        return fromAmount;
    }

    public void setFromAmount(BigDecimal fromAmount) {
        this.fromAmount = fromAmount;
    }

    public BigDecimal getToAmount() {
        return toAmount;
    }

    public void setToAmount(BigDecimal toAmount) {
        this.toAmount = toAmount;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
