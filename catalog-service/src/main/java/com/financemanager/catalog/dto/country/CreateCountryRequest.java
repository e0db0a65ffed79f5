package com.financemanager.catalog.dto.country;

import jakarta.validation.constraints.Size;

public class CreateCountryRequest {

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    public CreateCountryRequest() {
    }

    public CreateCountryRequest(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
