package com.financemanager.catalog.dto.account;

import com.financemanager.common.dto.PageFilter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Query parameters of {@code GET /api/v1/Account}. Absent fields do not filter.
 */
public class AccountFilter extends PageFilter {

    private UUID registryHolderId;
    private UUID accountTypeId;
    private UUID currencyId;
    private UUID bankId;
    private String nameContains;
    private Boolean isIncludeInBalance;
    private Boolean isDefault;
    private Boolean isArchived;
    private BigDecimal creditLimitFrom;
    private BigDecimal creditLimitTo;

    public AccountFilter() {
    }

    public AccountFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
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

    public String getNameContains() {
        return nameContains;
    }

    public void setNameContains(String nameContains) {
        this.nameContains = nameContains;
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

    public BigDecimal getCreditLimitFrom() {
        return creditLimitFrom;
    }

    public void setCreditLimitFrom(BigDecimal creditLimitFrom) {
        this.creditLimitFrom = creditLimitFrom;
    }

    public BigDecimal getCreditLimitTo() {
        return creditLimitTo;
    }

    public void setCreditLimitTo(BigDecimal creditLimitTo) {
        this.creditLimitTo = creditLimitTo;
    }
}
