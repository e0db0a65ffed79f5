package com.financemanager.transactions.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class TransferErrors {

    private static final String ENTITY = "Transfer";
    private static final String ACCOUNT = "Account";

    private TransferErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("TRANSFER_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException invalidAmount() {
        return new BusinessException(ErrorsFactory.required("TRANSFER_INVALID_AMOUNT", ENTITY, "amount"));
    }

    public static BusinessException accountNotFound(UUID accountId) {
        return new BusinessException(ErrorsFactory.notFound("TRANSFER_ACCOUNT_NOT_FOUND", ACCOUNT, accountId));
    }

    public static BusinessException accountSoftDeleted(UUID accountId) {
        return new BusinessException(ErrorsFactory.customNotFound("TRANSFER_ACCOUNT_SOFT_DELETED",
                String.format("Account '%s' is deleted and cannot be used for transfers", accountId)));
    }

    public static BusinessException accountArchived(UUID accountId) {
        return new BusinessException(ErrorsFactory.customConflict("TRANSFER_ACCOUNT_ARCHIVED",
                String.format("Account '%s' is archived and cannot be used for transfers", accountId)));
    }
}
