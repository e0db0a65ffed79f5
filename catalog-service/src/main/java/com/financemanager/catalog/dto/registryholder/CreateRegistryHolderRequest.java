package com.financemanager.catalog.dto.registryholder;

import com.financemanager.catalog.domain.RegistryHolderRole;

public class CreateRegistryHolderRequest {

    private Long telegramId;
    private RegistryHolderRole role;

    public CreateRegistryHolderRequest() {
    }

    public CreateRegistryHolderRequest(Long telegramId, RegistryHolderRole role) {
        this.telegramId = telegramId;
        this.role = role;
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
