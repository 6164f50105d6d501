package com.wpanther.credentialregistry.service;

import com.wpanther.credentialregistry.dto.AccountRegistrationRequest;
import com.wpanther.credentialregistry.dto.AccountRegistrationResponse;
import com.wpanther.credentialregistry.entity.RegistryAccount;
import com.wpanther.credentialregistry.exception.AccountRegistrationException;
import com.wpanther.credentialregistry.repository.RegistryAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;
import java.util.UUID;

/**
 * Creates the machine accounts that act in the registries. The generated clientId is the identity
 * every registry sees as the caller; an account carries the single {@value #REGISTRY_SCOPE} scope
 * whatever registry it later acts in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRegistrationService {

    public static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
    public static final String REGISTRY_SCOPE = "registry";

    private static final int SECRET_BYTES = 32;

    private final RegistryAccountRepository registryAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final SecureRandom secureRandom;

    @Transactional
    public AccountRegistrationResponse registerAccount(AccountRegistrationRequest request) {
        validateRegistrationRequest(request);

        String clientId = UUID.randomUUID().toString();
        String rawSecret = generateSecret();
        RegistryAccount account = createAccount(clientId, rawSecret, request.getClientName());

        log.info("Registered account: clientId={}, name={}", clientId, account.getClientName());

        return AccountRegistrationResponse.builder()
                .clientId(clientId)
                .clientSecret(rawSecret) // Only returned once during registration
                .clientName(account.getClientName())
                .scopes(account.getScopes())
                .grantTypes(account.getGrantTypes())
                .createdAt(account.getCreatedAt())
                .build();
    }

    /**
     * Creates the owner account under its configured credentials if it does not exist yet
     */
    @Transactional
    public boolean ensureAccount(String clientId, String rawSecret, String clientName) {
        if (registryAccountRepository.existsByClientId(clientId)) {
            return false;
        }
        createAccount(clientId, rawSecret, clientName);
        log.info("Provisioned account: clientId={}", clientId);
        return true;
    }

    private RegistryAccount createAccount(String clientId, String rawSecret, String clientName) {
        RegistryAccount account = RegistryAccount.builder()
                .id(UUID.randomUUID().toString())
                .clientId(clientId)
                .clientSecret(passwordEncoder.encode(rawSecret))
                .clientName(clientName)
                .scopes(Set.of(REGISTRY_SCOPE))
                .grantTypes(Set.of(GRANT_CLIENT_CREDENTIALS))
                .active(true)
                .createdAt(Instant.now())
                .build();

        return registryAccountRepository.save(account);
    }

    private String generateSecret() {
        byte[] randomBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    private void validateRegistrationRequest(AccountRegistrationRequest request) {
        // Accounts are machine identities: only client_credentials is supported
        if (!request.getGrantTypes().contains(GRANT_CLIENT_CREDENTIALS)) {
            throw new AccountRegistrationException("Only client_credentials grant type is supported");
        }
        if (request.getGrantTypes().size() > 1) {
            throw new AccountRegistrationException("Unsupported grant types: " + request.getGrantTypes());
        }
        if (request.getScopes() != null && !Set.of(REGISTRY_SCOPE).containsAll(request.getScopes())) {
            throw new AccountRegistrationException("Accounts may only request the " + REGISTRY_SCOPE + " scope");
        }
    }
}
