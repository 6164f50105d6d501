package com.wpanther.credentialregistry.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;

@Repository
public interface RegistryEventRepository extends JpaRepository<RegistryEvent, String> {

    /**
     * Find all events performed by an account in a registry
     */
    List<RegistryEvent> findByRegistryAndActorIdOrderByCreatedAtAsc(RegistryType registry, String actorId);

    /**
     * Find all events touching one target (a record, an authority or an admin grant)
     */
    List<RegistryEvent> findByRegistryAndTargetTypeAndTargetIdOrderByCreatedAtAsc(
            RegistryType registry, String targetType, String targetId);
}
