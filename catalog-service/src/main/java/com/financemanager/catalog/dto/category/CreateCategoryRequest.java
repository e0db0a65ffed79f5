package com.financemanager.catalog.dto.category;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public class CreateCategoryRequest {

    @NotNull(message = "Registry holder ID is required")
    private UUID registryHolderId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private Boolean income;
    private Boolean expense;
    private String emoji;
    private String icon;
    private UUID parentId;

    public CreateCategoryRequest() {
    }

    public CreateCategoryRequest(UUID registryHolderId,
                                 String name,
                                 Boolean income,
                                 Boolean expense,
                                 String emoji,
                                 String icon,
                                 UUID parentId) {
        this.registryHolderId = registryHolderId;
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.emoji = emoji;
        this.icon = icon;
        this.parentId = parentId;
    }

    public UUID getRegistryHolderId() {
        return registryHolderId;
    }

    public void setRegistryHolderId(UUID registryHolderId) {
        this.registryHolderId = registryHolderId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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

    public String getEmoji() {
        return emoji;
    }

    public void setEmoji(String emoji) {
        this.emoji = emoji;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public UUID getParentId() {
        return parentId;
    }

    public void setParentId(UUID parentId) {
        this.parentId = parentId;
    }
}
