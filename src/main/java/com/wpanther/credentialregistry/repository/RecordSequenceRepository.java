package com.wpanther.credentialregistry.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.RecordSequence;
import com.wpanther.credentialregistry.entity.RegistryType;

import jakarta.persistence.LockModeType;

@Repository
public interface RecordSequenceRepository extends JpaRepository<RecordSequence, RegistryType> {

    /**
     * Load the counter of a registry holding a write lock until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM RecordSequence s WHERE s.registry = :registry")
    Optional<RecordSequence> findForUpdate(@Param("registry") RegistryType registry);
}
