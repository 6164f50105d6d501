package com.wpanther.credentialregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class AccountRegistrationException extends RuntimeException {
    public AccountRegistrationException(String message) {
        super(message);
    }
}
