package com.wpanther.credentialregistry.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RecordKey;
import com.wpanther.credentialregistry.entity.RegistryType;

@Repository
public interface CredentialRecordRepository extends JpaRepository<CredentialRecord, RecordKey> {

    /**
     * Find all records held by a subject in a registry
     */
    List<CredentialRecord> findByIdRegistryAndSubjectIdOrderByIdRecordIdAsc(RegistryType registry, String subjectId);

    /**
     * Find all records owned by an authority in a registry
     */
    List<CredentialRecord> findByIdRegistryAndAuthorityIdOrderByIdRecordIdAsc(RegistryType registry, String authorityId);
}
