package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogCategory {

    private UUID id;
    private CatalogReference registryHolder;
    private String name;
    private boolean income;
    private boolean expense;
    private UUID parentId;

    public CatalogCategory() {
    }

    public CatalogCategory(UUID id, UUID registryHolderId, String name, boolean income, boolean expense,
                           UUID parentId) {
        this.id = id;
        this.registryHolder = new CatalogReference(registryHolderId);
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.parentId = parentId;
    }

    public UUID getId() { return id; }
    public CatalogReference getRegistryHolder() { return registryHolder; }
    public String getName() { return name; }
    public boolean getIncome() { return income; }
    public boolean getExpense() { return expense; }
    public UUID getParentId() { return parentId; }
}
