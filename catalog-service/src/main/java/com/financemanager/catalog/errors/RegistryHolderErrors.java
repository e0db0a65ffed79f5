package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class RegistryHolderErrors {

    private static final String ENTITY = "RegistryHolder";

    private RegistryHolderErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("REGISTRYHOLDER_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException telegramIdRequired() {
        return new BusinessException(ErrorsFactory.required("REGISTRYHOLDER_TELEGRAMID_REQUIRED", ENTITY, "telegramId"));
    }

    public static BusinessException telegramIdExists(long telegramId) {
        return new BusinessException(ErrorsFactory.alreadyExists("REGISTRYHOLDER_TELEGRAMID_EXISTS", ENTITY, "telegramId", telegramId));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("REGISTRYHOLDER_IN_USE", ENTITY, id));
    }
}
