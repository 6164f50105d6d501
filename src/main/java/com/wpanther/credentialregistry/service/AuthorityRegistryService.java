package com.wpanther.credentialregistry.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.dto.AuthorityRegistrationRequest;
import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.AuthorityRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Self-registration and admin vetting of issuers, hospitals and insurers
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorityRegistryService {

    private final AuthorityRepository authorityRepository;
    private final AdminAuthorizationService adminAuthorizationService;
    private final CallerIdentityService callerIdentityService;
    private final RegistryEventService registryEventService;
    private final LedgerClock ledgerClock;

    /**
     * Registers the calling account as an unverified authority of the registry
     */
    @Transactional
    public Authority register(RegistryType registry, AuthorityRegistrationRequest request) {
        String caller = callerIdentityService.currentCaller();
        RegistryAccountKey key = new RegistryAccountKey(registry, caller);

        if (authorityRepository.existsById(key)) {
            log.warn("Duplicate authority registration: registry={}, accountId={}", registry, caller);
            throw RegistryException.alreadyExists("Authority already registered for account " + caller);
        }

        long height = ledgerClock.currentHeight();
        Authority authority = Authority.builder()
                .id(key)
                .name(request.getName())
                .category(request.getCategory())
                .website(request.getWebsite())
                .location(request.getLocation())
                .verified(false)
                .active(true)
                .registeredAt(height)
                .createdAt(Instant.now())
                .build();

        Authority saved;
        try {
            // Flushed here so a concurrent registration of the same account fails inside this call
            saved = authorityRepository.saveAndFlush(authority);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent authority registration: registry={}, accountId={}", registry, caller);
            throw RegistryException.alreadyExists("Authority already registered for account " + caller);
        }
        registryEventService.record(registry, RegistryEventService.ACTION_AUTHORITY_REGISTERED, caller,
                RegistryEvent.TARGET_AUTHORITY, caller, request.getName(), height);

        log.info("Authority registered: registry={}, accountId={}, name={}", registry, caller, request.getName());
        return saved;
    }

    /**
     * Sets the verified flag of an authority. Admin only; no other field changes.
     */
    @Transactional
    public Authority setVerified(RegistryType registry, String authorityId, boolean verified) {
        String caller = callerIdentityService.currentCaller();
        adminAuthorizationService.requireAdmin(registry, caller);

        Authority existing = authorityRepository.findById(new RegistryAccountKey(registry, authorityId))
                .orElseThrow(() -> RegistryException.notFound("Authority not found: " + authorityId));

        long height = ledgerClock.currentHeight();
        Authority updated = existing.toBuilder()
                .verified(verified)
                .updatedAt(Instant.now())
                .build();

        Authority saved = authorityRepository.save(updated);
        registryEventService.record(registry, RegistryEventService.ACTION_AUTHORITY_VERIFIED, caller,
                RegistryEvent.TARGET_AUTHORITY, authorityId, "verified=" + verified, height);

        log.info("Authority verification changed: registry={}, accountId={}, verified={}, by={}",
                registry, authorityId, verified, caller);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Authority> getAuthority(RegistryType registry, String authorityId) {
        return authorityRepository.findById(new RegistryAccountKey(registry, authorityId));
    }

    /**
     * Lists authorities by verification state, used by admins to find pending registrations
     */
    @Transactional(readOnly = true)
    public List<Authority> listAuthorities(RegistryType registry, boolean verified) {
        return authorityRepository.findByIdRegistryAndVerified(registry, verified);
    }

    /**
     * Fails with NOT_FOUND for unregistered accounts and UNAUTHORIZED for unverified authorities.
     */
    @Transactional(readOnly = true)
    public Authority requireVerifiedAuthority(RegistryType registry, String accountId) {
        Authority authority = authorityRepository.findById(new RegistryAccountKey(registry, accountId))
                .orElseThrow(() -> RegistryException.notFound("Authority not registered: " + accountId));

        if (!authority.isVerified()) {
            log.warn("Unverified authority attempted issuance: registry={}, accountId={}", registry, accountId);
            throw RegistryException.unauthorized("Authority " + accountId + " is not verified");
        }
        return authority;
    }
}
