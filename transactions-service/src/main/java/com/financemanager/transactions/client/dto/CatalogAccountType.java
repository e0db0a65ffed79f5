package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogAccountType {

    private UUID id;
    private String code;
    private String description;
    private boolean isDeleted;

    public CatalogAccountType() {
    }

    public CatalogAccountType(UUID id, String code, String description, boolean isDeleted) {
        this.id = id;
        this.code = code;
        this.description = description;
        this.isDeleted = isDeleted;
    }

    public UUID getId() { return id; }
    public String getCode() { return code; }
    public String getDescription() { return description; }
    public boolean getIsDeleted() { return isDeleted; }
}
