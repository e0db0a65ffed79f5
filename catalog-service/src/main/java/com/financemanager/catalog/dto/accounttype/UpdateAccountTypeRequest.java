package com.financemanager.catalog.dto.accounttype;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
public class UpdateAccountTypeRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    @Size(max = 100, message = "Code must be at most 100 characters")
    private String code;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    public UpdateAccountTypeRequest() {
    }

    public UpdateAccountTypeRequest(UUID id, String code, String description) {
        this.id = id;
        this.code = code;
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
