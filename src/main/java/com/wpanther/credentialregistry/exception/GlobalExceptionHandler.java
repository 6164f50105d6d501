package com.wpanther.credentialregistry.exception;

import org.springframework.beans.TypeMismatchException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.Nullable;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders every failure as an {@link ErrorResponse}. Spring MVC's own request errors
 * (unsupported method or media type, unknown path, missing parameter) keep their 4xx status.
 */
@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistryException(RegistryException ex) {
        if (ex.getCode() == RegistryErrorCode.UNAUTHORIZED) {
            log.warn("Registry operation denied: {}", ex.getMessage());
        } else {
            log.info("Registry operation rejected [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return createErrorResponse(ex.getCode().name(), ex.getMessage(), ex.getCode().getHttpStatus());
    }

    @ExceptionHandler(AccountRegistrationException.class)
    public ResponseEntity<ErrorResponse> handleAccountRegistrationException(AccountRegistrationException ex) {
        log.info("Account registration rejected: {}", ex.getMessage());
        return createErrorResponse(RegistryErrorCode.INVALID_INPUT.name(), ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent update rejected: {}", ex.getMessage());
        return createErrorResponse("CONFLICT", "The entry was modified concurrently, retry the call", HttpStatus.CONFLICT);
    }

    // Two calls inserting the same key; the losing one is rolled back
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentInsert(DataIntegrityViolationException ex) {
        log.warn("Concurrent insert rejected: {}", ex.getMostSpecificCause().getMessage());
        return createErrorResponse("CONFLICT", "The entry was created concurrently, retry the call", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedException(Exception ex) {
        log.error("Unexpected error", ex);
        return createErrorResponse("SERVER_ERROR", "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        log.info("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        ValidationErrorResponse errorResponse = new ValidationErrorResponse(
            RegistryErrorCode.INVALID_INPUT.name(),
            "Validation failed",
            HttpStatus.BAD_REQUEST.value(),
            Instant.now(),
            errors
        );

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        log.info("Malformed request body: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(RegistryErrorCode.INVALID_INPUT.name(), "Malformed request body",
                HttpStatus.BAD_REQUEST.value(), Instant.now()), HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleTypeMismatch(TypeMismatchException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        log.info("Malformed request parameter: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(RegistryErrorCode.INVALID_INPUT.name(),
                "Invalid value for " + ex.getPropertyName(), HttpStatus.BAD_REQUEST.value(), Instant.now()),
                HttpStatus.BAD_REQUEST);
    }

    /**
     * Remaining Spring MVC errors keep their status and get the same body shape as registry errors
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, @Nullable Object body,
            HttpHeaders headers, HttpStatusCode statusCode, WebRequest request) {
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String error = status != null ? status.name() : "REQUEST_REJECTED";
        String message = body instanceof ProblemDetail ? ((ProblemDetail) body).getDetail() : ex.getMessage();

        log.info("Request rejected [{}]: {}", statusCode.value(), ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(error, message, statusCode.value(), Instant.now()),
                headers, statusCode);
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String error, String message, HttpStatus status) {
        ErrorResponse errorResponse = new ErrorResponse(
            error,
            message,
            status.value(),
            Instant.now()
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    // Error response classes
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final int status;
        private final Instant timestamp;

        public ErrorResponse(String error, String message, int status, Instant timestamp) {
            this.error = error;
            this.message = message;
            this.status = status;
            this.timestamp = timestamp;
        }

        public String getError() {
            return error;
        }

        public String getMessage() {
            return message;
        }

        public int getStatus() {
            return status;
        }

        public Instant getTimestamp() {
            return timestamp;
        }
    }

    public static class ValidationErrorResponse extends ErrorResponse {
        private final Map<String, String> errors;

        public ValidationErrorResponse(String error, String message, int status, Instant timestamp,
                Map<String, String> errors) {
            super(error, message, status, timestamp);
            this.errors = errors;
        }

        public Map<String, String> getErrors() {
            return errors;
        }
    }
}
