package com.wpanther.credentialregistry.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.AdminGrant;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryType;

@Repository
public interface AdminGrantRepository extends JpaRepository<AdminGrant, RegistryAccountKey> {

    /**
     * Find the admins currently authorized in a registry
     */
    List<AdminGrant> findByIdRegistryAndAuthorizedTrue(RegistryType registry);
}
