package com.wpanther.credentialregistry.service;

import java.time.Instant;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.entity.AdminGrant;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.AdminGrantRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Admin set of each registry plus the owner identity that manages it.
 * The owner is configuration, not an admin entry, so no call can remove it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminAuthorizationService {

    private final AdminGrantRepository adminGrantRepository;
    private final CallerIdentityService callerIdentityService;
    private final RegistryEventService registryEventService;
    private final LedgerClock ledgerClock;

    @Value("${app.registry.owner.client-id}")
    private String ownerId;

    /**
     * Grants admin rights in a registry. Owner only.
     */
    @Transactional
    public void addAdmin(RegistryType registry, String accountId) {
        String caller = callerIdentityService.currentCaller();
        requireOwner(caller);
        long height = ledgerClock.currentHeight();

        saveGrant(registry, accountId, true, caller);
        registryEventService.record(registry, RegistryEventService.ACTION_ADMIN_ADDED, caller,
                RegistryEvent.TARGET_ADMIN, accountId, null, height);
        log.info("Admin added: registry={}, accountId={}", registry, accountId);
    }

    /**
     * Revokes admin rights in a registry. Owner only.
     */
    @Transactional
    public void removeAdmin(RegistryType registry, String accountId) {
        String caller = callerIdentityService.currentCaller();
        requireOwner(caller);
        long height = ledgerClock.currentHeight();

        saveGrant(registry, accountId, false, caller);
        registryEventService.record(registry, RegistryEventService.ACTION_ADMIN_REMOVED, caller,
                RegistryEvent.TARGET_ADMIN, accountId, null, height);
        log.info("Admin removed: registry={}, accountId={}", registry, accountId);
    }

    /**
     * Unknown accounts are simply not admins.
     */
    @Transactional(readOnly = true)
    public boolean isAdmin(RegistryType registry, String accountId) {
        return adminGrantRepository.findById(new RegistryAccountKey(registry, accountId))
                .map(AdminGrant::isAuthorized)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<String> listAdmins(RegistryType registry) {
        return adminGrantRepository.findByIdRegistryAndAuthorizedTrue(registry).stream()
                .map(grant -> grant.getId().getAccountId())
                .toList();
    }

    public boolean isOwner(String accountId) {
        return ownerId != null && ownerId.equals(accountId);
    }

    public void requireOwner(String caller) {
        if (!isOwner(caller)) {
            log.warn("Owner check failed: caller={}", caller);
            throw RegistryException.unauthorized("Only the registry owner may manage admins");
        }
    }

    public void requireAdmin(RegistryType registry, String caller) {
        if (!isAdmin(registry, caller)) {
            log.warn("Admin check failed: registry={}, caller={}", registry, caller);
            throw RegistryException.unauthorized("Caller is not an admin of the " + registry.getPathSegment() + " registry");
        }
    }

    /**
     * Updates the stored grant under its version, or inserts a new one. The insert is flushed so that
     * a concurrent grant for the same account fails inside this call and rolls it back.
     */
    private void saveGrant(RegistryType registry, String accountId, boolean authorized, String grantedBy) {
        RegistryAccountKey key = new RegistryAccountKey(registry, accountId);
        AdminGrant grant = adminGrantRepository.findById(key)
                .map(AdminGrant::toBuilder)
                .orElseGet(() -> AdminGrant.builder().id(key))
                .authorized(authorized)
                .grantedBy(grantedBy)
                .updatedAt(Instant.now())
                .build();
        adminGrantRepository.saveAndFlush(grant);
    }
}
