package com.financemanager.catalog.dto.country;

import com.financemanager.common.dto.PageFilter;

public class CountryFilter extends PageFilter {

    private String nameContains;

    public CountryFilter() {
    }

    public CountryFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public String getNameContains() {
        return nameContains;
    }

    public void setNameContains(String nameContains) {
        this.nameContains = nameContains;
    }
}
