package com.financemanager.common.error;

import org.springframework.http.HttpStatus;

/**
 * Generic error shapes shared by all per-entity error factories.
 *
 * Pure functions: same input, same {@link ApiError}. Each shape fixes the HTTP status
 * and the message template; the caller supplies the application code.
 */
public final class ErrorsFactory {

    private ErrorsFactory() {
    }

    public static ApiError notFound(String code, String entityName, Object id) {
        return new ApiError(code, HttpStatus.NOT_FOUND,
                String.format("%s with id '%s' not found.", entityName, id));
    }

    public static ApiError alreadyExists(String code, String entityName, String fieldName, Object value) {
        return new ApiError(code, HttpStatus.CONFLICT,
                String.format("%s with %s '%s' already exists.", entityName, fieldName, value));
    }

    public static ApiError required(String code, String entityName, String fieldName) {
        return new ApiError(code, HttpStatus.BAD_REQUEST,
                String.format("%s %s can't be empty.", entityName, fieldName));
    }

    public static ApiError cannotDeleteUsedEntity(String code, String entityName, Object id) {
        return new ApiError(code, HttpStatus.CONFLICT,
                String.format("Cannot delete %s '%s' because it is used in other entities", entityName, id));
    }

    public static ApiError customConflict(String code, String message) {
        return new ApiError(code, HttpStatus.CONFLICT, message);
    }

    public static ApiError customNotFound(String code, String message) {
        return new ApiError(code, HttpStatus.NOT_FOUND, message);
    }

    /**
     * A service this one depends on failed or answered with something unusable.
     */
    public static ApiError badGateway(String code, String message) {
        return new ApiError(code, HttpStatus.BAD_GATEWAY, message);
    }
}
