package com.financemanager.catalog.dto.registryholder;

import com.financemanager.catalog.domain.RegistryHolderRole;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
public class UpdateRegistryHolderRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    private Long telegramId;
    private RegistryHolderRole role;

    public UpdateRegistryHolderRequest() {
    }

    public UpdateRegistryHolderRequest(UUID id, Long telegramId, RegistryHolderRole role) {
        this.id = id;
        this.telegramId = telegramId;
        this.role = role;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Long getTelegramId() {
        return telegramId;
    }

    public void setTelegramId(Long telegramId) {
        this.telegramId = telegramId;
    }

    public RegistryHolderRole getRole() {
        return role;
    }

    public void setRole(RegistryHolderRole role) {
        this.role = role;
    }
}
