package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class BankErrors {

    private static final String ENTITY = "Bank";

    private BankErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("BANK_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException nameExists(String name) {
        return new BusinessException(ErrorsFactory.alreadyExists("BANK_NAME_EXISTS", ENTITY, "name", name));
    }

    public static BusinessException nameRequired() {
        return new BusinessException(ErrorsFactory.required("BANK_NAME_REQUIRED", ENTITY, "name"));
    }

    public static BusinessException countryNotFound(UUID countryId) {
        return new BusinessException(ErrorsFactory.notFound("BANK_COUNTRY_NOT_FOUND", "Country", countryId));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("BANK_IN_USE", ENTITY, id));
    }
}
