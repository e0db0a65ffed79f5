package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

/**
 * Errors of account operations. Codes are part of the public API.
 */
public final class AccountErrors {

    private static final String ENTITY = "Account";

    private AccountErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException defaultNotFound(UUID registryHolderId) {
        return new BusinessException(ErrorsFactory.customNotFound("ACCOUNT_DEFAULT_NOT_FOUND",
                String.format("Default account for registry holder '%s' not found", registryHolderId)));
    }

    public static BusinessException nameRequired() {
        return new BusinessException(ErrorsFactory.required("ACCOUNT_NAME_REQUIRED", ENTITY, "name"));
    }

    public static BusinessException registryHolderNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_REGISTRYHOLDER_NOT_FOUND", "RegistryHolder", id));
    }

    public static BusinessException accountTypeNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_ACCOUNTTYPE_NOT_FOUND", "AccountType", id));
    }

    public static BusinessException accountTypeSoftDeleted(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_ACCOUNTTYPE_SOFT_DELETED",
                String.format("AccountType '%s' is soft deleted and cannot be used for accounts", id)));
    }

    public static BusinessException currencyNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_CURRENCY_NOT_FOUND", "Currency", id));
    }

    public static BusinessException currencySoftDeleted(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_CURRENCY_SOFT_DELETED",
                String.format("Currency '%s' is soft deleted and cannot be used for accounts", id)));
    }

    public static BusinessException bankNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_BANK_NOT_FOUND", "Bank", id));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("ACCOUNT_IN_USE", ENTITY, id));
    }

    public static BusinessException cannotSoftDeleteDefault(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_CANNOT_SOFT_DELETE_DEFAULT",
                String.format("Cannot perform soft deletion for default account '%s'", id)));
    }

    public static BusinessException cannotDeleteDefault(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_CANNOT_DELETE_DEFAULT",
                String.format("Cannot delete default account '%s'", id)));
    }

    public static BusinessException cannotArchiveDefault(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_CANNOT_ARCHIVE_DEFAULT",
                String.format("Cannot archive or delete default account '%s'", id)));
    }

    public static BusinessException cannotBeDefaultIfArchivedOrDeleted(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_CANNOT_BE_DEFAULT_IF_ARCHIVED_OR_DELETED",
                String.format("Account '%s' is archived or deleted and cannot be default", id)));
    }

    public static BusinessException replacementNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("ACCOUNT_REPLACEMENT_DEFAULT_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException replacementCannotBeDefault(UUID id) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_REPLACEMENT_CANNOT_BE_DEFAULT",
                String.format("Replacement account '%s' is archived or deleted and cannot be default", id)));
    }

    public static BusinessException registryHolderDiffers(UUID accountId, UUID replacementId) {
        return new BusinessException(ErrorsFactory.customConflict("ACCOUNT_REGISTRYHOLDER_DIFFERS",
                String.format("Accounts '%s' and '%s' belong to different registry holders", accountId, replacementId)));
    }
}
