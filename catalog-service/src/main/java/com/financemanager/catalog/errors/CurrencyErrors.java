package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class CurrencyErrors {

    private static final String ENTITY = "Currency";

    private CurrencyErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("CURRENCY_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException charCodeExists(String charCode) {
        return new BusinessException(ErrorsFactory.alreadyExists("CURRENCY_CHARCODE_EXISTS", ENTITY, "charCode", charCode));
    }

    public static BusinessException numCodeExists(String numCode) {
        return new BusinessException(ErrorsFactory.alreadyExists("CURRENCY_NUMCODE_EXISTS", ENTITY, "numCode", numCode));
    }

    public static BusinessException charCodeRequired() {
        return new BusinessException(ErrorsFactory.required("CURRENCY_CHARCODE_REQUIRED", ENTITY, "charCode"));
    }

    public static BusinessException numCodeRequired() {
        return new BusinessException(ErrorsFactory.required("CURRENCY_NUMCODE_REQUIRED", ENTITY, "numCode"));
    }

    public static BusinessException nameRequired() {
        return new BusinessException(ErrorsFactory.required("CURRENCY_NAME_REQUIRED", ENTITY, "name"));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("CURRENCY_IN_USE", ENTITY, id));
    }
}
