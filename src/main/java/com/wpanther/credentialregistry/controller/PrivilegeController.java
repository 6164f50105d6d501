package com.wpanther.credentialregistry.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.credentialregistry.dto.PrivilegeGrantRequest;
import com.wpanther.credentialregistry.dto.RecordCreatedResponse;
import com.wpanther.credentialregistry.dto.RecordResponse;
import com.wpanther.credentialregistry.dto.RenewalRequest;
import com.wpanther.credentialregistry.dto.StatusUpdateRequest;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.service.RecordLedgerService;
import com.wpanther.credentialregistry.service.ValidityEvaluator;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

/**
 * Hospital privileging registry: procedure privileges granted by verified hospitals
 */
@RestController
@RequestMapping("/api/v1/privileges")
@Slf4j
public class PrivilegeController extends RecordReadController {

    public PrivilegeController(RecordLedgerService recordLedgerService, ValidityEvaluator validityEvaluator) {
        super(recordLedgerService, validityEvaluator);
    }

    @Override
    protected RegistryType registry() {
        return RegistryType.PRIVILEGE;
    }

    @PostMapping
    public ResponseEntity<RecordCreatedResponse> grant(@Valid @RequestBody PrivilegeGrantRequest request) {
        log.debug("Granting privilege {} to {}", request.getProcedureCode(), request.getSubjectId());
        long recordId = recordLedgerService.issue(registry(), request.getSubjectId(), request.toPayload());
        return new ResponseEntity<>(new RecordCreatedResponse(registry(), recordId), HttpStatus.CREATED);
    }

    @PutMapping("/{recordId}/status")
    public ResponseEntity<RecordResponse> updateStatus(@PathVariable long recordId,
            @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(RecordResponse.from(recordLedgerService.updateStatus(
                registry(), recordId, request.getStatus(), request.getRestrictions())));
    }

    @PutMapping("/{recordId}/expiration")
    public ResponseEntity<RecordResponse> renew(@PathVariable long recordId,
            @Valid @RequestBody RenewalRequest request) {
        return ResponseEntity.ok(RecordResponse.from(recordLedgerService.renew(
                registry(), recordId, request.getExpiresAt())));
    }
}
