package com.financemanager.common.error;

import org.springframework.http.HttpStatus;

import java.util.Objects;

/**
 * Structured business error: a stable application code, the HTTP status it maps to
 * and a human-readable message.
 *
 * Produced by {@link ErrorsFactory} and the per-entity error factories built on it.
 * Clients branch on {@link #getCode()}, never on the message text.
 */
public final class ApiError {

    private final String code;
    private final HttpStatus status;
    private final String message;

    public ApiError(String code, HttpStatus status, String message) {
        this.code = Objects.requireNonNull(code, "code");
        this.status = Objects.requireNonNull(status, "status");
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApiError apiError = (ApiError) o;
        return code.equals(apiError.code)
                && status == apiError.status
                && message.equals(apiError.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, status, message);
    }

    @Override
    public String toString() {
        return "ApiError{" +
                "code='" + code + '\'' +
                ", status=" + status.value() +
                ", message='" + message + '\'' +
                '}';
    }
}
