package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.financemanager.transactions.domain.Role;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogRegistryHolder {

    private UUID id;
    private long telegramId;
    private Role role;

    public CatalogRegistryHolder() {
    }

    public CatalogRegistryHolder(UUID id, long telegramId, Role role) {
        this.id = id;
        this.telegramId = telegramId;
        this.role = role;
    }

    public UUID getId() { return id; }
    public long getTelegramId() { return telegramId; }
    public Role getRole() { return role; }
}
