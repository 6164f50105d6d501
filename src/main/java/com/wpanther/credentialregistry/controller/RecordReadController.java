package com.wpanther.credentialregistry.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import com.wpanther.credentialregistry.dto.RecordResponse;
import com.wpanther.credentialregistry.dto.ValidityResponse;
import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.service.RecordLedgerService;
import com.wpanther.credentialregistry.service.ValidityEvaluator;

/**
 * Read endpoints shared by the qualification, privilege and panel controllers
 */
public abstract class RecordReadController {

    protected final RecordLedgerService recordLedgerService;
    protected final ValidityEvaluator validityEvaluator;

    protected RecordReadController(RecordLedgerService recordLedgerService, ValidityEvaluator validityEvaluator) {
        this.recordLedgerService = recordLedgerService;
        this.validityEvaluator = validityEvaluator;
    }

    protected abstract RegistryType registry();

    @GetMapping("/{recordId}")
    public ResponseEntity<RecordResponse> getRecord(@PathVariable long recordId) {
        return recordLedgerService.getRecord(registry(), recordId)
                .map(RecordResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{recordId}/validity")
    public ResponseEntity<ValidityResponse> isValid(@PathVariable long recordId) {
        return ResponseEntity.ok(ValidityResponse.builder()
                .registry(registry())
                .recordId(recordId)
                .valid(validityEvaluator.isValid(registry(), recordId))
                .build());
    }

    /**
     * List records by subject or by authority; exactly one filter must be given
     */
    @GetMapping
    public ResponseEntity<List<RecordResponse>> listRecords(
            @RequestParam(required = false) String subjectId,
            @RequestParam(required = false) String authorityId) {
        if ((subjectId == null) == (authorityId == null)) {
            throw RegistryException.invalidInput("Specify exactly one of subjectId or authorityId");
        }
        List<CredentialRecord> records = subjectId != null
                ? recordLedgerService.getRecordsBySubject(registry(), subjectId)
                : recordLedgerService.getRecordsByAuthority(registry(), authorityId);
        return ResponseEntity.ok(records.stream().map(RecordResponse::from).toList());
    }
}
