package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.util.UUID;

public final class CategoryErrors {

    private static final String ENTITY = "Category";

    private CategoryErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("CATEGORY_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException nameRequired() {
        return new BusinessException(ErrorsFactory.required("CATEGORY_NAME_REQUIRED", ENTITY, "name"));
    }

    public static BusinessException nameAlreadyExists(String name) {
        return new BusinessException(ErrorsFactory.alreadyExists("CATEGORY_NAME_ALREADY_EXISTS", ENTITY, "name", name));
    }

    public static BusinessException inUse(UUID id) {
        return new BusinessException(ErrorsFactory.cannotDeleteUsedEntity("CATEGORY_IN_USE", ENTITY, id));
    }

    public static BusinessException registryHolderNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("CATEGORY_REGISTRYHOLDER_NOT_FOUND", "RegistryHolder", id));
    }

    public static BusinessException parentNotFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("CATEGORY_PARENT_NOT_FOUND", ENTITY, id));
    }

    /**
     * @param id category being placed, or null for a category not yet created
     */
    public static BusinessException recursiveParent(UUID id, UUID parentId) {
        return new BusinessException(ErrorsFactory.customConflict("CATEGORY_RECURSIVE_PARENT",
                String.format("Cannot set category '%s' as child of '%s' due to recursive relation", id, parentId)));
    }
}
