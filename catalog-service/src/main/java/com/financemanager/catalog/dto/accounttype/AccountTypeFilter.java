package com.financemanager.catalog.dto.accounttype;

import com.financemanager.common.dto.PageFilter;

public class AccountTypeFilter extends PageFilter {

    private String code;
    private String descriptionContains;

    public AccountTypeFilter() {
    }

    public AccountTypeFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDescriptionContains() {
        return descriptionContains;
    }

    public void setDescriptionContains(String descriptionContains) {
        this.descriptionContains = descriptionContains;
    }
}
