package com.wpanther.credentialregistry.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.service.AdminAuthorizationService;
import com.wpanther.credentialregistry.service.CallerIdentityService;
import com.wpanther.credentialregistry.service.RecordLedgerService;
import com.wpanther.credentialregistry.service.RegistryEventService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail access
 */
@RestController
@RequestMapping("/api/v1/registries/{registry}/events")
@RequiredArgsConstructor
@Slf4j
public class RegistryEventController {

    private final RegistryEventService registryEventService;
    private final RecordLedgerService recordLedgerService;
    private final AdminAuthorizationService adminAuthorizationService;
    private final CallerIdentityService callerIdentityService;

    /**
     * Events performed by the authenticated account
     */
    @GetMapping
    public ResponseEntity<List<RegistryEvent>> getOwnEvents(@PathVariable RegistryType registry) {
        String caller = callerIdentityService.currentCaller();
        log.debug("Fetching {} events of {}", registry, caller);
        return ResponseEntity.ok(registryEventService.getEventsByActor(registry, caller));
    }

    /**
     * Events of one record, visible to its authority and to registry admins
     */
    @GetMapping("/records/{recordId}")
    public ResponseEntity<List<RegistryEvent>> getRecordEvents(@PathVariable RegistryType registry,
            @PathVariable long recordId) {
        String caller = callerIdentityService.currentCaller();
        CredentialRecord record = recordLedgerService.getRecord(registry, recordId)
                .orElseThrow(() -> RegistryException.notFound("Record not found: " + recordId));

        if (!record.getAuthorityId().equals(caller) && !adminAuthorizationService.isAdmin(registry, caller)) {
            throw RegistryException.unauthorized("Only the record's authority or an admin may read its events");
        }
        return ResponseEntity.ok(registryEventService.getEventsByTarget(
                registry, RegistryEvent.TARGET_RECORD, String.valueOf(recordId)));
    }
}
