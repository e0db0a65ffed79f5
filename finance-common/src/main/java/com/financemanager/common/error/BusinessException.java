package com.financemanager.common.error;

import org.springframework.http.HttpStatus;

/**
 * Carries an {@link ApiError} out of the service layer.
 *
 * Unchecked so that the enclosing {@code @Transactional} service method rolls back.
 * Every check in a service runs before its single save, so a rollback never has
 * partial work to undo.
 */
public class BusinessException extends RuntimeException {

    private final ApiError error;

    public BusinessException(ApiError error) {
        super(error.getMessage());
        this.error = error;
    }

    public BusinessException(ApiError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public ApiError getError() {
        return error;
    }

    public String getCode() {
        return error.getCode();
    }

    public HttpStatus getStatus() {
        return error.getStatus();
    }
}
