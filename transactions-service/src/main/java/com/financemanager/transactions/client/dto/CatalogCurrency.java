package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogCurrency {

    private UUID id;
    private String charCode;
    private String numCode;
    private String name;
    private String sign;
    private boolean isDeleted;

    public CatalogCurrency() {
    }

    public CatalogCurrency(UUID id, String charCode, String numCode, String name, String sign, boolean isDeleted) {
        this.id = id;
        this.charCode = charCode;
        this.numCode = numCode;
        this.name = name;
        this.sign = sign;
        this.isDeleted = isDeleted;
    }

    public UUID getId() { return id; }
    public String getCharCode() { return charCode; }
    public String getNumCode() { return numCode; }
    public String getName() { return name; }
    public String getSign() { return sign; }
    public boolean getIsDeleted() { return isDeleted; }
}
