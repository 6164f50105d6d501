package com.wpanther.credentialregistry.exception;

/**
 * Failure of a registry operation. Thrown inside a transaction, so the whole call is rolled back.
 */
public class RegistryException extends RuntimeException {

    private final RegistryErrorCode code;

    public RegistryException(RegistryErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RegistryErrorCode getCode() {
        return code;
    }

    public static RegistryException unauthorized(String message) {
        return new RegistryException(RegistryErrorCode.UNAUTHORIZED, message);
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(RegistryErrorCode.NOT_FOUND, message);
    }

    public static RegistryException alreadyExists(String message) {
        return new RegistryException(RegistryErrorCode.ALREADY_EXISTS, message);
    }

    public static RegistryException invalidInput(String message) {
        return new RegistryException(RegistryErrorCode.INVALID_INPUT, message);
    }
}
