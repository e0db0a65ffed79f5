package com.financemanager.catalog.dto.bank;

import com.financemanager.common.dto.PageFilter;

import java.util.UUID;

public class BankFilter extends PageFilter {

    private UUID countryId;
    private String nameContains;

    public BankFilter() {
    }

    public BankFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public UUID getCountryId() {
        return countryId;
    }

    public void setCountryId(UUID countryId) {
        this.countryId = countryId;
    }

    public String getNameContains() {
        return nameContains;
    }

    public void setNameContains(String nameContains) {
        this.nameContains = nameContains;
    }
}
