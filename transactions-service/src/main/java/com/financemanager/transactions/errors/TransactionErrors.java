package com.financemanager.transactions.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class TransactionErrors {

    private static final String ENTITY = "Transaction";
    private static final String ACCOUNT = "Account";
    private static final String CATEGORY = "Category";

    private TransactionErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("TRANSACTION_NOT_FOUND", ENTITY, id));
    }

    /**
     * Zero amount; the sign carries the direction, so any other value is valid.
     */
    public static BusinessException invalidAmount() {
        return new BusinessException(ErrorsFactory.required("TRANSACTION_INVALID_AMOUNT", ENTITY, "amount"));
    }

    public static BusinessException accountNotFound(UUID accountId) {
        return new BusinessException(ErrorsFactory.notFound("TRANSACTION_ACCOUNT_NOT_FOUND", ACCOUNT, accountId));
    }

    public static BusinessException accountSoftDeleted(UUID accountId) {
        return new BusinessException(ErrorsFactory.customNotFound("TRANSACTION_ACCOUNT_SOFT_DELETED",
                String.format("Account '%s' is deleted and cannot be used for transactions", accountId)));
    }

    public static BusinessException accountArchived(UUID accountId) {
        return new BusinessException(ErrorsFactory.customConflict("TRANSACTION_ACCOUNT_ARCHIVED",
                String.format("Account '%s' is archived and cannot be used for transactions", accountId)));
    }

    public static BusinessException categoryNotFound(UUID categoryId) {
        return new BusinessException(ErrorsFactory.notFound("TRANSACTION_CATEGORY_NOT_FOUND", CATEGORY, categoryId));
    }

    public static BusinessException categorySoftDeleted(UUID categoryId) {
        return new BusinessException(ErrorsFactory.customNotFound("TRANSACTION_CATEGORY_SOFT_DELETED",
                String.format("Category '%s' is deleted and cannot be used for transactions", categoryId)));
    }
}
