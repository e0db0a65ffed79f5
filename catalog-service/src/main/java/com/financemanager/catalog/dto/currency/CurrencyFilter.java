package com.financemanager.catalog.dto.currency;

import com.financemanager.common.dto.PageFilter;

public class CurrencyFilter extends PageFilter {

    private String nameContains;
    private String charCode;
    private String numCode;

    public CurrencyFilter() {
    }

    public CurrencyFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public String getNameContains() {
        return nameContains;
    }

    public void setNameContains(String nameContains) {
        this.nameContains = nameContains;
    }

    public String getCharCode() {
        return charCode;
    }

    public void setCharCode(String charCode) {
        this.charCode = charCode;
    }

    public String getNumCode() {
        return numCode;
    }

    public void setNumCode(String numCode) {
        this.numCode = numCode;
    }
}
