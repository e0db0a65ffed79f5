package com.financemanager.catalog.dto.accounttype;

import jakarta.validation.constraints.Size;

public class CreateAccountTypeRequest {

    @Size(max = 100, message = "Code must be at most 100 characters")
    private String code;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    public CreateAccountTypeRequest() {
    }

    public CreateAccountTypeRequest(String code, String description) {
        this.code = code;
        this.description = description;
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
