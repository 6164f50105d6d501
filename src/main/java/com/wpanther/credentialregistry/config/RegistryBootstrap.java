package com.wpanther.credentialregistry.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.entity.RecordSequence;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.repository.RecordSequenceRepository;
import com.wpanther.credentialregistry.service.AccountRegistrationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds the record counters of each registry and provisions the owner account on startup
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryBootstrap implements ApplicationRunner {

    private final RecordSequenceRepository recordSequenceRepository;
    private final AccountRegistrationService accountRegistrationService;

    @Value("${app.registry.owner.client-id}")
    private String ownerClientId;

    @Value("${app.registry.owner.client-secret:}")
    private String ownerClientSecret;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        for (RegistryType registry : RegistryType.values()) {
            if (!recordSequenceRepository.existsById(registry)) {
                recordSequenceRepository.save(RecordSequence.builder().registry(registry).lastId(0L).build());
                log.info("Initialized record counter for registry {}", registry);
            }
        }

        if (ownerClientSecret == null || ownerClientSecret.isBlank()) {
            log.warn("No owner secret configured, owner account {} must already exist", ownerClientId);
            return;
        }
        accountRegistrationService.ensureAccount(ownerClientId, ownerClientSecret, "Registry owner");
    }
}
