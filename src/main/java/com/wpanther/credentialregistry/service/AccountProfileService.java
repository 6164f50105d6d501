package com.wpanther.credentialregistry.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.credentialregistry.dto.AccountProfileResponse;
import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryAccount;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.RegistryAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Tells an account what it may do in each registry: admin rights, authority registration and vetting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountProfileService {

    private final RegistryAccountRepository registryAccountRepository;
    private final AdminAuthorizationService adminAuthorizationService;
    private final AuthorityRegistryService authorityRegistryService;
    private final CallerIdentityService callerIdentityService;

    @Transactional(readOnly = true)
    public AccountProfileResponse currentProfile() {
        String caller = callerIdentityService.currentCaller();
        RegistryAccount account = registryAccountRepository.findByClientId(caller)
                .orElseThrow(() -> RegistryException.notFound("No account for " + caller));

        AccountProfileResponse.AccountProfileResponseBuilder profile = AccountProfileResponse.builder()
                .clientId(account.getClientId())
                .clientName(account.getClientName())
                .createdAt(account.getCreatedAt())
                .owner(adminAuthorizationService.isOwner(caller));

        for (RegistryType registry : RegistryType.values()) {
            Authority authority = authorityRegistryService.getAuthority(registry, caller).orElse(null);
            profile.membership(AccountProfileResponse.Membership.builder()
                    .registry(registry)
                    .admin(adminAuthorizationService.isAdmin(registry, caller))
                    .authority(authority != null)
                    .authorityVerified(authority != null && authority.isVerified())
                    .build());
        }

        log.debug("Profile resolved for account {}", caller);
        return profile.build();
    }
}
