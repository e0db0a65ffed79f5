package com.financemanager.catalog.dto.bank;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
public class UpdateBankRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    private UUID countryId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    public UpdateBankRequest() {
    }

    public UpdateBankRequest(UUID id, UUID countryId, String name) {
        this.id = id;
        this.countryId = countryId;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getCountryId() {
        return countryId;
    }

    public void setCountryId(UUID countryId) {
        this.countryId = countryId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
