package com.financemanager.transactions.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * Nested catalog object of which only the id is replicated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogReference {

    private UUID id;

    public CatalogReference() {
    }

    public CatalogReference(UUID id) {
        this.id = id;
    }

    public UUID getId() { return id; }
}
