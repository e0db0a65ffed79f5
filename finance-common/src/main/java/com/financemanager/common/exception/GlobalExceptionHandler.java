package com.financemanager.common.exception;

import com.financemanager.common.config.MdcKeys;
import com.financemanager.common.error.BusinessException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as an RFC 7807 problem-details body.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                       | HTTP Status      | When
 * -------------------------------------|------------------|----------------------------------------
 * BusinessException                    | from ApiError    | Business rule violation from a service
 * BindException (incl. @Valid failure) | 400              | Bean Validation failure on DTO / filter
 * HttpMessageNotReadableException      | 400              | Malformed JSON body
 * MethodArgumentTypeMismatchException  | 400              | Bad UUID / number / date in path or query
 * MissingServletRequestParameterException | 400           | Required query parameter absent
 * IllegalArgumentException             | 400              | Invalid argument reaching a service
 * IllegalStateException                | 422              | Unreachable state / invalid operation
 * DataIntegrityViolationException      | 409              | Storage constraint hit despite the checks
 * ErrorResponse (Spring MVC)           | its own status   | Unknown route, unsupported method
 * Exception (fallback)                 | 500              | Unexpected system errors
 *
 * Every body carries {@code errorCode} and {@code traceId}; the trace id is the
 * request id put into MDC by {@code MdcLoggingFilter}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusiness(BusinessException ex, HttpServletRequest request) {
        log.warn("Business rule violated: {} ({})", ex.getCode(), ex.getMessage());
        return problem(ex.getStatus(), ex.getCode(), ex.getMessage(), request);
    }

    /**
     * Field → message map in an {@code errors} property for clearer API feedback.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ProblemDetail> handleValidation(BindException ex, HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        ResponseEntity<ProblemDetail> response = problem(
                HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", request);
        response.getBody().setProperty("errors", errors);
        return response;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "ARGUMENT_TYPE_MISMATCH",
                String.format("Parameter '%s' has an invalid value '%s'", ex.getName(), ex.getValue()), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "ARGUMENT_REQUIRED",
                String.format("Parameter '%s' is required", ex.getParameterName()), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex,
                                                               HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "ARGUMENT_INVALID", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ProblemDetail> handleIllegalState(IllegalStateException ex, HttpServletRequest request) {
        log.error("Invalid operation", ex);
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_OPERATION", ex.getMessage(), request);
    }

    /**
     * A concurrent request can slip past a service-level uniqueness check and hit the
     * database constraint; that still surfaces as a conflict.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "DATA_INTEGRITY_VIOLATION",
                "The change conflicts with existing data", request);
    }

    /**
     * Message is generic; internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            // unknown route, unsupported method or media type
            return problem(errorResponse.getStatusCode(), "REQUEST_REJECTED", ex.getMessage(), request);
        }
        log.error("Unhandled exception", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please contact support.", request);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatusCode status, String code, String detail,
                                                  HttpServletRequest request) {
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, detail);
        HttpStatus resolved = HttpStatus.resolve(status.value());
        body.setTitle(resolved != null ? resolved.getReasonPhrase() : "Error");
        body.setInstance(URI.create(request.getRequestURI()));
        body.setProperty("errorCode", code);
        body.setProperty("traceId", MDC.get(MdcKeys.REQUEST_ID));
        return ResponseEntity.status(status).body(body);
    }
}
