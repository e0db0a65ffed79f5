package com.financemanager.catalog.dto.category;

import com.financemanager.common.dto.PageFilter;

import java.util.UUID;

public class CategoryFilter extends PageFilter {

    private UUID registryHolderId;
    private String nameContains;
    private Boolean income;
    private Boolean expense;
    private UUID parentId;

    public CategoryFilter() {
    }

    public CategoryFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public UUID getRegistryHolderId() {
        return registryHolderId;
    }

    public void setRegistryHolderId(UUID registryHolderId) {
        this.registryHolderId = registryHolderId;
    }

    public String getNameContains() {
        return nameContains;
    }

    public void setNameContains(String nameContains) {
        this.nameContains = nameContains;
    }

    public Boolean getIncome() {
        return income;
    }

    public void setIncome(Boolean income) {
        this.income = income;
    }

    public Boolean getExpense() {
        return expense;
    }

    public void setExpense(Boolean expense) {
        this.expense = expense;
    }

    public UUID getParentId() {
        return parentId;
    }

    public void setParentId(UUID parentId) {
        this.parentId = parentId;
    }
}
