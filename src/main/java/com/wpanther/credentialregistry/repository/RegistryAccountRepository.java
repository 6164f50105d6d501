package com.wpanther.credentialregistry.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.RegistryAccount;

@Repository
public interface RegistryAccountRepository extends JpaRepository<RegistryAccount, String> {

    Optional<RegistryAccount> findByClientId(String clientId);

    boolean existsByClientId(String clientId);
}
