package com.wpanther.credentialregistry.service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.repository.RegistryEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail of registry mutations
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryEventService {

    public static final String ACTION_ADMIN_ADDED = "ADMIN_ADDED";
    public static final String ACTION_ADMIN_REMOVED = "ADMIN_REMOVED";
    public static final String ACTION_AUTHORITY_REGISTERED = "AUTHORITY_REGISTERED";
    public static final String ACTION_AUTHORITY_VERIFIED = "AUTHORITY_VERIFIED";
    public static final String ACTION_RECORD_ISSUED = "RECORD_ISSUED";
    public static final String ACTION_RECORD_SELF_REPORTED = "RECORD_SELF_REPORTED";
    public static final String ACTION_RECORD_VERIFIED = "RECORD_VERIFIED";
    public static final String ACTION_STATUS_UPDATED = "STATUS_UPDATED";
    public static final String ACTION_RECORD_RENEWED = "RECORD_RENEWED";

    private final RegistryEventRepository registryEventRepository;

    /**
     * Appends an event to the caller's transaction. Must run inside the mutation it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RegistryEvent record(RegistryType registry, String action, String actorId,
            String targetType, String targetId, String details, long ledgerHeight) {
        RegistryEvent event = RegistryEvent.builder()
                .id(UUID.randomUUID().toString())
                .registry(registry)
                .action(action)
                .actorId(actorId)
                .targetType(targetType)
                .targetId(targetId)
                .details(details)
                .ledgerHeight(ledgerHeight)
                .createdAt(Instant.now())
                .build();

        registryEventRepository.save(event);
        log.debug("Recorded {} event: registry={}, actor={}, target={}:{}",
                action, registry, actorId, targetType, targetId);
        return event;
    }

    /**
     * Events performed by an account
     */
    @Transactional(readOnly = true)
    public List<RegistryEvent> getEventsByActor(RegistryType registry, String actorId) {
        return registryEventRepository.findByRegistryAndActorIdOrderByCreatedAtAsc(registry, actorId);
    }

    /**
     * Events touching one target
     */
    @Transactional(readOnly = true)
    public List<RegistryEvent> getEventsByTarget(RegistryType registry, String targetType, String targetId) {
        return registryEventRepository.findByRegistryAndTargetTypeAndTargetIdOrderByCreatedAtAsc(
                registry, targetType, targetId);
    }
}
