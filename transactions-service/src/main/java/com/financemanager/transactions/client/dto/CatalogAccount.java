package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Account as listed by the catalog; holder, type and currency arrive as nested objects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogAccount {

    private UUID id;
    private CatalogReference registryHolder;
    private CatalogReference accountType;
    private CatalogReference currency;
    private String name;
    private BigDecimal creditLimit;
    private boolean isArchived;
    private boolean isDeleted;

    public CatalogAccount() {
    }

    public CatalogAccount(UUID id, UUID registryHolderId, UUID accountTypeId, UUID currencyId, String name,
                          BigDecimal creditLimit, boolean isArchived, boolean isDeleted) {
        this.id = id;
        this.registryHolder = new CatalogReference(registryHolderId);
        this.accountType = new CatalogReference(accountTypeId);
        this.currency = new CatalogReference(currencyId);
        this.name = name;
        this.creditLimit = creditLimit;
        this.isArchived = isArchived;
        this.isDeleted = isDeleted;
    }

    public UUID getId() { return id; }
    public CatalogReference getRegistryHolder() { return registryHolder; }
    public CatalogReference getAccountType() { return accountType; }
    public CatalogReference getCurrency() { return currency; }
    public String getName() { return name; }
    public BigDecimal getCreditLimit() { return creditLimit; }
    public boolean getIsArchived() { return isArchived; }
    public boolean getIsDeleted() { return isDeleted; }
}
