package com.financemanager.catalog.dto.bank;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public class CreateBankRequest {

    @NotNull(message = "Country ID is required")
    private UUID countryId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    public CreateBankRequest() {
    }

    public CreateBankRequest(UUID countryId, String name) {
        this.countryId = countryId;
        this.name = name;
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
