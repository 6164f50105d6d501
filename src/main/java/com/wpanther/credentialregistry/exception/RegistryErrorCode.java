package com.wpanther.credentialregistry.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by the three registries.
 */
public enum RegistryErrorCode {

    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    // Reserved, nothing raises it yet
    EXPIRED(HttpStatus.GONE);

    private final HttpStatus httpStatus;

    RegistryErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
