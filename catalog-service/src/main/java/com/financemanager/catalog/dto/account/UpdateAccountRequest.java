package com.financemanager.catalog.dto.account;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Partial update: only non-null fields that differ from the stored value are applied.
 */
public class UpdateAccountRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    private UUID accountTypeId;
    private UUID currencyId;
    private UUID bankId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private Boolean isIncludeInBalance;
    private Boolean isDefault;
    private Boolean isArchived;
    private BigDecimal creditLimit;

    public UpdateAccountRequest() {
    }

    public UpdateAccountRequest(UUID id,
                                UUID accountTypeId,
                                UUID currencyId,
                                UUID bankId,
                                String name,
                                Boolean isIncludeInBalance,
                                Boolean isDefault,
                                Boolean isArchived,
                                BigDecimal creditLimit) {
        this.id = id;
        this.accountTypeId = accountTypeId;
        this.currencyId = currencyId;
        this.bankId = bankId;
        this.name = name;
        this.isIncludeInBalance = isIncludeInBalance;
        this.isDefault = isDefault;
        this.isArchived = isArchived;
        this.creditLimit = creditLimit;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getAccountTypeId() {
        return accountTypeId;
    }

    public void setAccountTypeId(UUID accountTypeId) {
        this.accountTypeId = accountTypeId;
    }

    public UUID getCurrencyId() {
        return currencyId;
    }

    public void setCurrencyId(UUID currencyId) {
        this.currencyId = currencyId;
    }

    public UUID getBankId() {
        return bankId;
    }

    public void setBankId(UUID bankId) {
        this.bankId = bankId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Boolean getIsIncludeInBalance() {
        return isIncludeInBalance;
    }

    public void setIsIncludeInBalance(Boolean isIncludeInBalance) {
        this.isIncludeInBalance = isIncludeInBalance;
    }

    public Boolean getIsDefault() {
        return isDefault;
    }

    public void setIsDefault(Boolean isDefault) {
        this.isDefault = isDefault;
    }

    public Boolean getIsArchived() {
        return isArchived;
    }

    public void setIsArchived(Boolean isArchived) {
        this.isArchived = isArchived;
    }

    public BigDecimal getCreditLimit() {
        return creditLimit;
    }

    public void setCreditLimit(BigDecimal creditLimit) {
        this.creditLimit = creditLimit;
    }
}
