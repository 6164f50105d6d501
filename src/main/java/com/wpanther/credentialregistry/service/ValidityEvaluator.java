package com.wpanther.credentialregistry.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RecordKey;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.repository.CredentialRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers whether a record is currently usable: usable status and not expired.
 * Read-only; a missing record is simply not valid.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidityEvaluator {

    private final CredentialRecordRepository recordRepository;
    private final LedgerClock ledgerClock;

    @Transactional(readOnly = true)
    public boolean isValid(RegistryType registry, long recordId) {
        long height = ledgerClock.currentHeight();
        boolean valid = recordRepository.findById(new RecordKey(registry, recordId))
                .map(record -> isValidAt(record, height))
                .orElse(false);

        log.debug("Validity check: registry={}, recordId={}, height={}, valid={}", registry, recordId, height, valid);
        return valid;
    }

    public static boolean isValidAt(CredentialRecord record, long height) {
        return hasUsableStatus(record) && isUnexpiredAt(record, height);
    }

    static boolean hasUsableStatus(CredentialRecord record) {
        if (record.getRegistry().usesVerificationFlag()) {
            return record.isVerified();
        }
        return CredentialRecord.STATUS_ACTIVE.equals(record.getStatus());
    }

    static boolean isUnexpiredAt(CredentialRecord record, long height) {
        long expiresAt = record.getExpiresAt();
        return expiresAt == CredentialRecord.NEVER_EXPIRES || expiresAt > height;
    }
}
