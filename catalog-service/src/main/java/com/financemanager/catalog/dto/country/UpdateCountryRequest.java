package com.financemanager.catalog.dto.country;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public class UpdateCountryRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    public UpdateCountryRequest() {
    }

    public UpdateCountryRequest(UUID id, String name) {
        this.id = id;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
