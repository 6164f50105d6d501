package com.wpanther.credentialregistry.service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.dto.RecordPayload;
import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RecordKey;
import com.wpanther.credentialregistry.entity.RecordSequence;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.CredentialRecordRepository;
import com.wpanther.credentialregistry.repository.RecordSequenceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creation and lifecycle of qualification, privilege and panel records.
 *
 * <p>Every mutation is one transaction: preconditions are checked before the ID counter moves,
 * and any failure rolls the call back. Updates rebuild the full record from the stored one
 * and overwrite only the targeted fields.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordLedgerService {

    private final CredentialRecordRepository recordRepository;
    private final RecordSequenceRepository sequenceRepository;
    private final AuthorityRegistryService authorityRegistryService;
    private final CallerIdentityService callerIdentityService;
    private final RegistryEventService registryEventService;
    private final LedgerClock ledgerClock;

    /**
     * Issues a record from the calling verified authority. The record starts verified (qualifications)
     * or active (privileges, panel memberships).
     *
     * @return the new record ID
     */
    @Transactional
    public long issue(RegistryType registry, String subjectId, RecordPayload payload) {
        String caller = callerIdentityService.currentCaller();
        authorityRegistryService.requireVerifiedAuthority(registry, caller);
        requireNonNegativeExpiry(payload.getExpiresAt());

        long height = ledgerClock.currentHeight();
        long recordId = allocateRecordId(registry);

        CredentialRecord.CredentialRecordBuilder builder = newRecord(registry, recordId, subjectId, caller, payload, height);
        if (registry.usesVerificationFlag()) {
            builder.verified(true).verifiedAt(height);
        } else {
            builder.status(CredentialRecord.STATUS_ACTIVE);
        }

        recordRepository.save(builder.build());
        registryEventService.record(registry, RegistryEventService.ACTION_RECORD_ISSUED, caller,
                RegistryEvent.TARGET_RECORD, String.valueOf(recordId), "subject=" + subjectId, height);

        log.info("Record issued: registry={}, recordId={}, subject={}, authority={}",
                registry, recordId, subjectId, caller);
        return recordId;
    }

    /**
     * Records a qualification reported by its holder. It stays unverified until the named
     * authority verifies it; the authority does not need to exist yet.
     *
     * @return the new record ID
     */
    @Transactional
    public long selfReport(RegistryType registry, String authorityId, RecordPayload payload) {
        requireVerificationFlag(registry, "self-report");
        requireNonNegativeExpiry(payload.getExpiresAt());
        String caller = callerIdentityService.currentCaller();

        long height = ledgerClock.currentHeight();
        long recordId = allocateRecordId(registry);

        CredentialRecord record = newRecord(registry, recordId, caller, authorityId, payload, height)
                .verified(false)
                .build();

        recordRepository.save(record);
        registryEventService.record(registry, RegistryEventService.ACTION_RECORD_SELF_REPORTED, caller,
                RegistryEvent.TARGET_RECORD, String.valueOf(recordId), "authority=" + authorityId, height);

        log.info("Record self-reported: registry={}, recordId={}, subject={}, authority={}",
                registry, recordId, caller, authorityId);
        return recordId;
    }

    /**
     * Marks a self-reported qualification verified. Only the record's authority may call this.
     * A record that is already verified keeps its original verification height.
     */
    @Transactional
    public CredentialRecord verify(RegistryType registry, long recordId) {
        requireVerificationFlag(registry, "verify");
        String caller = callerIdentityService.currentCaller();
        CredentialRecord existing = loadOwnedRecord(registry, recordId, caller);

        long height = ledgerClock.currentHeight();
        Long verifiedAt = existing.isVerified() && existing.getVerifiedAt() != null
                ? existing.getVerifiedAt()
                : Long.valueOf(height);
        CredentialRecord updated = existing.toBuilder()
                .attributes(new HashMap<>(existing.getAttributes()))
                .verified(true)
                .verifiedAt(verifiedAt)
                .lastUpdatedAt(height)
                .updatedAt(Instant.now())
                .build();

        CredentialRecord saved = recordRepository.save(updated);
        registryEventService.record(registry, RegistryEventService.ACTION_RECORD_VERIFIED, caller,
                RegistryEvent.TARGET_RECORD, String.valueOf(recordId), null, height);

        log.info("Record verified: registry={}, recordId={}, authority={}", registry, recordId, caller);
        return saved;
    }

    /**
     * Replaces the status tag of a privilege or panel membership. Any tag is accepted;
     * only {@value CredentialRecord#STATUS_ACTIVE} counts as valid. A null
     * {@code restrictions} keeps the stored restrictions.
     */
    @Transactional
    public CredentialRecord updateStatus(RegistryType registry, long recordId, String newStatus, String restrictions) {
        requireStatusTag(registry, "update status");
        String caller = callerIdentityService.currentCaller();
        CredentialRecord existing = loadOwnedRecord(registry, recordId, caller);

        long height = ledgerClock.currentHeight();
        CredentialRecord updated = existing.toBuilder()
                .attributes(new HashMap<>(existing.getAttributes()))
                .status(newStatus)
                .notes(restrictions != null ? restrictions : existing.getNotes())
                .lastUpdatedAt(height)
                .updatedAt(Instant.now())
                .build();

        CredentialRecord saved = recordRepository.save(updated);
        registryEventService.record(registry, RegistryEventService.ACTION_STATUS_UPDATED, caller,
                RegistryEvent.TARGET_RECORD, String.valueOf(recordId),
                existing.getStatus() + " -> " + newStatus, height);

        log.info("Record status updated: registry={}, recordId={}, status={}", registry, recordId, newStatus);
        return saved;
    }

    /**
     * Moves the expiration of a privilege or panel membership. 0 means the record never expires.
     */
    @Transactional
    public CredentialRecord renew(RegistryType registry, long recordId, long newExpiresAt) {
        requireStatusTag(registry, "renew");
        requireNonNegativeExpiry(newExpiresAt);
        String caller = callerIdentityService.currentCaller();
        CredentialRecord existing = loadOwnedRecord(registry, recordId, caller);

        long height = ledgerClock.currentHeight();
        CredentialRecord updated = existing.toBuilder()
                .attributes(new HashMap<>(existing.getAttributes()))
                .expiresAt(newExpiresAt)
                .lastUpdatedAt(height)
                .updatedAt(Instant.now())
                .build();

        CredentialRecord saved = recordRepository.save(updated);
        registryEventService.record(registry, RegistryEventService.ACTION_RECORD_RENEWED, caller,
                RegistryEvent.TARGET_RECORD, String.valueOf(recordId),
                existing.getExpiresAt() + " -> " + newExpiresAt, height);

        log.info("Record renewed: registry={}, recordId={}, expiresAt={}", registry, recordId, newExpiresAt);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<CredentialRecord> getRecord(RegistryType registry, long recordId) {
        return recordRepository.findById(new RecordKey(registry, recordId));
    }

    @Transactional(readOnly = true)
    public List<CredentialRecord> getRecordsBySubject(RegistryType registry, String subjectId) {
        return recordRepository.findByIdRegistryAndSubjectIdOrderByIdRecordIdAsc(registry, subjectId);
    }

    @Transactional(readOnly = true)
    public List<CredentialRecord> getRecordsByAuthority(RegistryType registry, String authorityId) {
        return recordRepository.findByIdRegistryAndAuthorityIdOrderByIdRecordIdAsc(registry, authorityId);
    }

    /**
     * Takes the next ID under a row lock on the registry counter
     */
    private long allocateRecordId(RegistryType registry) {
        RecordSequence sequence = sequenceRepository.findForUpdate(registry)
                .orElseGet(() -> RecordSequence.builder().registry(registry).lastId(0L).build());
        long recordId = sequence.next();
        sequenceRepository.save(sequence);
        return recordId;
    }

    private CredentialRecord.CredentialRecordBuilder newRecord(RegistryType registry, long recordId,
            String subjectId, String authorityId, RecordPayload payload, long height) {
        return CredentialRecord.builder()
                .id(new RecordKey(registry, recordId))
                .subjectId(subjectId)
                .authorityId(authorityId)
                .attributes(new HashMap<>(payload.getAttributes()))
                .notes(payload.getNotes())
                .issuedAt(height)
                .expiresAt(payload.getExpiresAt())
                .lastUpdatedAt(height)
                .createdAt(Instant.now());
    }

    private CredentialRecord loadOwnedRecord(RegistryType registry, long recordId, String caller) {
        CredentialRecord record = recordRepository.findById(new RecordKey(registry, recordId))
                .orElseThrow(() -> RegistryException.notFound("Record not found: " + recordId));

        if (!record.getAuthorityId().equals(caller)) {
            log.warn("Record mutation denied: registry={}, recordId={}, caller={}, authority={}",
                    registry, recordId, caller, record.getAuthorityId());
            throw RegistryException.unauthorized("Only the record's authority may modify record " + recordId);
        }
        return record;
    }

    private void requireNonNegativeExpiry(long expiresAt) {
        if (expiresAt < 0) {
            throw RegistryException.invalidInput("Expiration height must not be negative");
        }
    }

    private void requireVerificationFlag(RegistryType registry, String operation) {
        if (!registry.usesVerificationFlag()) {
            throw RegistryException.invalidInput("Cannot " + operation + " in the " + registry.getPathSegment() + " registry");
        }
    }

    private void requireStatusTag(RegistryType registry, String operation) {
        if (!registry.usesStatusTag()) {
            throw RegistryException.invalidInput("Cannot " + operation + " in the " + registry.getPathSegment() + " registry");
        }
    }
}
