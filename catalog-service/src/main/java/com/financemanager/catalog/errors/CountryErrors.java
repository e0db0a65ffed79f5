package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class CountryErrors {

    private static final String ENTITY = "Country";

    private CountryErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("COUNTRY_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException nameExists(String name) {
        return new BusinessException(ErrorsFactory.alreadyExists("COUNTRY_NAME_EXISTS", ENTITY, "name", name));
    }

    public static BusinessException nameRequired() {
        return new BusinessException(ErrorsFactory.required("COUNTRY_NAME_REQUIRED", ENTITY, "name"));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("COUNTRY_IN_USE", ENTITY, id));
    }
}
