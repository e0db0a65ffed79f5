package com.financemanager.catalog.dto.registryholder;

import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.common.dto.PageFilter;

public class RegistryHolderFilter extends PageFilter {

    private Long telegramId;
    private RegistryHolderRole role;

    public RegistryHolderFilter() {
    }

    public RegistryHolderFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
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
