package com.wpanther.credentialregistry.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.credentialregistry.dto.AdminStatusResponse;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.service.AdminAuthorizationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Admin-set management of a registry. Changes are reserved to the owner.
 */
@RestController
@RequestMapping("/api/v1/registries/{registry}/admins")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AdminAuthorizationService adminAuthorizationService;

    @GetMapping
    public ResponseEntity<List<String>> listAdmins(@PathVariable RegistryType registry) {
        return ResponseEntity.ok(adminAuthorizationService.listAdmins(registry));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AdminStatusResponse> isAdmin(@PathVariable RegistryType registry,
            @PathVariable String accountId) {
        return ResponseEntity.ok(statusOf(registry, accountId));
    }

    @PutMapping("/{accountId}")
    public ResponseEntity<AdminStatusResponse> addAdmin(@PathVariable RegistryType registry,
            @PathVariable String accountId) {
        log.debug("Adding admin {} to registry {}", accountId, registry);
        adminAuthorizationService.addAdmin(registry, accountId);
        return ResponseEntity.ok(statusOf(registry, accountId));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<AdminStatusResponse> removeAdmin(@PathVariable RegistryType registry,
            @PathVariable String accountId) {
        log.debug("Removing admin {} from registry {}", accountId, registry);
        adminAuthorizationService.removeAdmin(registry, accountId);
        return ResponseEntity.ok(statusOf(registry, accountId));
    }

    private AdminStatusResponse statusOf(RegistryType registry, String accountId) {
        return AdminStatusResponse.builder()
                .registry(registry)
                .accountId(accountId)
                .admin(adminAuthorizationService.isAdmin(registry, accountId))
                .build();
    }
}
