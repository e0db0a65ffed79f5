package com.financemanager.catalog.dto.category;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged. A null {@code parentId} keeps the
 * current parent; {@code detachFromParent = true} moves the category to the top level
 * and is ignored when a {@code parentId} is given.
 */
public class UpdateCategoryRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private Boolean income;
    private Boolean expense;
    private String emoji;
    private String icon;
    private UUID parentId;
    private Boolean detachFromParent;

    public UpdateCategoryRequest() {
    }

    public UpdateCategoryRequest(UUID id,
                                 String name,
                                 Boolean income,
                                 Boolean expense,
                                 String emoji,
                                 String icon,
                                 UUID parentId) {
        this.id = id;
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.emoji = emoji;
        this.icon = icon;
        this.parentId = parentId;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
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

    public Boolean getDetachFromParent() {
        return detachFromParent;
    }

    public void setDetachFromParent(Boolean detachFromParent) {
        this.detachFromParent = detachFromParent;
    }
}
