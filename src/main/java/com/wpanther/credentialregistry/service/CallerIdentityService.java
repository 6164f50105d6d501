package com.wpanther.credentialregistry.service;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Service;

import com.wpanther.credentialregistry.exception.RegistryException;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the account performing the current call. The identity always comes from the
 * security context, never from request data.
 */
@Service
@Slf4j
public class CallerIdentityService {

    public String currentCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        log.debug("Authentication type: {}", authentication != null ? authentication.getClass().getName() : "null");

        if (authentication instanceof JwtAuthenticationToken) {
            JwtAuthenticationToken jwtAuth = (JwtAuthenticationToken) authentication;
            return jwtAuth.getName();
        }

        if (authentication != null
                && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken)
                && authentication.getName() != null) {
            return authentication.getName();
        }

        throw RegistryException.unauthorized("Unable to determine caller from security context");
    }
}
