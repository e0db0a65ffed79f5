package com.financemanager.catalog.dto.account;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * DTO for account creation. When isDefault is true the holder's current
 * default account loses the flag.
 */
public class CreateAccountRequest {

    @NotNull(message = "Registry holder ID is required")
    private UUID registryHolderId;

    @NotNull(message = "Account type ID is required")
    private UUID accountTypeId;

    @NotNull(message = "Currency ID is required")
    private UUID currencyId;

    private UUID bankId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private Boolean isIncludeInBalance;
    private Boolean isDefault;
    private BigDecimal creditLimit;

    public CreateAccountRequest() {
    }

    public CreateAccountRequest(UUID registryHolderId,
                                UUID accountTypeId,
                                UUID currencyId,
                                UUID bankId,
                                String name,
                                Boolean isIncludeInBalance,
                                Boolean isDefault,
                                BigDecimal creditLimit) {
        this.registryHolderId = registryHolderId;
        this.accountTypeId = accountTypeId;
        this.currencyId = currencyId;
        this.bankId = bankId;
        this.name = name;
        this.isIncludeInBalance = isIncludeInBalance;
        this.isDefault = isDefault;
        this.creditLimit = creditLimit;
    }

    public UUID getRegistryHolderId() {
        return registryHolderId;
    }

    public void setRegistryHolderId(UUID registryHolderId) {
        this.registryHolderId = registryHolderId;
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

    public BigDecimal getCreditLimit() {
        return creditLimit;
    }

    public void setCreditLimit(BigDecimal creditLimit) {
        this.creditLimit = creditLimit;
    }
}
