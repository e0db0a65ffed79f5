package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class AccountTypeErrors {

    private static final String ENTITY = "AccountType";

    private AccountTypeErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNTTYPE_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException codeExists(String code) {
        return new BusinessException(ErrorsFactory.alreadyExists("ACCOUNTTYPE_CODE_EXISTS", ENTITY, "code", code));
    }

    public static BusinessException codeRequired() {
        return new BusinessException(ErrorsFactory.required("ACCOUNTTYPE_CODE_REQUIRED", ENTITY, "code"));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("ACCOUNTTYPE_IN_USE", ENTITY, id));
    }
}
