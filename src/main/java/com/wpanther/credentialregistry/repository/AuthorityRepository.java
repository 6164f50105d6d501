package com.wpanther.credentialregistry.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryType;

@Repository
public interface AuthorityRepository extends JpaRepository<Authority, RegistryAccountKey> {

    /**
     * Find all authorities of a registry with the given verification state
     */
    List<Authority> findByIdRegistryAndVerified(RegistryType registry, boolean verified);
}
