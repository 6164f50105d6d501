package com.wpanther.credentialregistry.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.credentialregistry.dto.AuthorityRegistrationRequest;
import com.wpanther.credentialregistry.dto.AuthorityResponse;
import com.wpanther.credentialregistry.dto.AuthorityVerificationRequest;
import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.service.AuthorityRegistryService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registration and verification of issuers, hospitals and insurers
 */
@RestController
@RequestMapping("/api/v1/registries/{registry}/authorities")
@RequiredArgsConstructor
@Slf4j
public class AuthorityController {

    private final AuthorityRegistryService authorityRegistryService;

    /**
     * Register the authenticated account as an authority
     */
    @PostMapping
    public ResponseEntity<AuthorityResponse> register(@PathVariable RegistryType registry,
            @Valid @RequestBody AuthorityRegistrationRequest request) {
        log.debug("Authority registration in {}: {}", registry, request.getName());
        Authority authority = authorityRegistryService.register(registry, request);
        return new ResponseEntity<>(AuthorityResponse.from(authority), HttpStatus.CREATED);
    }

    /**
     * Set the verified flag of an authority (admins only)
     */
    @PutMapping("/{authorityId}/verification")
    public ResponseEntity<AuthorityResponse> setVerified(@PathVariable RegistryType registry,
            @PathVariable String authorityId,
            @Valid @RequestBody AuthorityVerificationRequest request) {
        Authority authority = authorityRegistryService.setVerified(registry, authorityId, request.getVerified());
        return ResponseEntity.ok(AuthorityResponse.from(authority));
    }

    @GetMapping("/{authorityId}")
    public ResponseEntity<AuthorityResponse> getAuthority(@PathVariable RegistryType registry,
            @PathVariable String authorityId) {
        return authorityRegistryService.getAuthority(registry, authorityId)
                .map(AuthorityResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<AuthorityResponse>> listAuthorities(@PathVariable RegistryType registry,
            @RequestParam(defaultValue = "true") boolean verified) {
        List<AuthorityResponse> authorities = authorityRegistryService.listAuthorities(registry, verified).stream()
                .map(AuthorityResponse::from)
                .toList();
        return ResponseEntity.ok(authorities);
    }
}
