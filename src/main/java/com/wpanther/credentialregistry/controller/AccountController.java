package com.wpanther.credentialregistry.controller;

import com.wpanther.credentialregistry.dto.AccountProfileResponse;
import com.wpanther.credentialregistry.dto.AccountRegistrationRequest;
import com.wpanther.credentialregistry.dto.AccountRegistrationResponse;
import com.wpanther.credentialregistry.service.AccountProfileService;
import com.wpanther.credentialregistry.service.AccountRegistrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account onboarding. Registration is open; the profile needs the account's own token.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountRegistrationService accountRegistrationService;
    private final AccountProfileService accountProfileService;

    @PostMapping("/account-registration")
    public ResponseEntity<AccountRegistrationResponse> registerAccount(@Valid @RequestBody AccountRegistrationRequest request) {
        log.debug("Account registration requested: name={}", request.getClientName());
        return new ResponseEntity<>(accountRegistrationService.registerAccount(request), HttpStatus.CREATED);
    }

    @GetMapping("/api/v1/accounts/me")
    public ResponseEntity<AccountProfileResponse> currentAccount() {
        return ResponseEntity.ok(accountProfileService.currentProfile());
    }
}
