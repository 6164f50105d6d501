package com.wpanther.credentialregistry.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.credentialregistry.dto.QualificationIssueRequest;
import com.wpanther.credentialregistry.dto.QualificationSelfReportRequest;
import com.wpanther.credentialregistry.dto.RecordCreatedResponse;
import com.wpanther.credentialregistry.dto.RecordResponse;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.service.RecordLedgerService;
import com.wpanther.credentialregistry.service.ValidityEvaluator;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

/**
 * Qualification verification registry: issued by verified issuers or self-reported by providers
 */
@RestController
@RequestMapping("/api/v1/qualifications")
@Slf4j
public class QualificationController extends RecordReadController {

    public QualificationController(RecordLedgerService recordLedgerService, ValidityEvaluator validityEvaluator) {
        super(recordLedgerService, validityEvaluator);
    }

    @Override
    protected RegistryType registry() {
        return RegistryType.QUALIFICATION;
    }

    @PostMapping
    public ResponseEntity<RecordCreatedResponse> issue(@Valid @RequestBody QualificationIssueRequest request) {
        log.debug("Issuing qualification {} to {}", request.getQualificationName(), request.getSubjectId());
        long recordId = recordLedgerService.issue(registry(), request.getSubjectId(), request.toPayload());
        return new ResponseEntity<>(new RecordCreatedResponse(registry(), recordId), HttpStatus.CREATED);
    }

    @PostMapping("/self-reports")
    public ResponseEntity<RecordCreatedResponse> selfReport(@Valid @RequestBody QualificationSelfReportRequest request) {
        log.debug("Self-reporting qualification {} against {}", request.getQualificationName(), request.getAuthorityId());
        long recordId = recordLedgerService.selfReport(registry(), request.getAuthorityId(), request.toPayload());
        return new ResponseEntity<>(new RecordCreatedResponse(registry(), recordId), HttpStatus.CREATED);
    }

    @PostMapping("/{recordId}/verification")
    public ResponseEntity<RecordResponse> verify(@PathVariable long recordId) {
        return ResponseEntity.ok(RecordResponse.from(recordLedgerService.verify(registry(), recordId)));
    }
}
