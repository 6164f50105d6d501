package com.wpanther.credentialregistry.service;

import com.wpanther.credentialregistry.entity.RegistryAccount;
import com.wpanther.credentialregistry.repository.RegistryAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.security.oauth2.server.authorization.client.RegisteredClient;
import org.springframework.security.oauth2.server.authorization.client.RegisteredClientRepository;
import org.springframework.security.oauth2.server.authorization.settings.ClientSettings;
import org.springframework.security.oauth2.server.authorization.settings.TokenSettings;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Lets registry accounts authenticate at the token endpoint. Every account gets the same
 * client_credentials registration limited to the registry scope; the stored row only supplies
 * the identity, the secret hash and whether the account may still obtain tokens.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRegisteredClientRepository implements RegisteredClientRepository {

    /** Access token claim carrying the account's display name next to its clientId subject. */
    public static final String ACCOUNT_NAME_CLAIM = "account_name";

    private final RegistryAccountRepository registryAccountRepository;

    @Value("${app.security.access-token-ttl:PT1H}")
    private String accessTokenTtl;

    @Override
    public void save(RegisteredClient registeredClient) {
        throw new UnsupportedOperationException("Registry accounts are created through account registration");
    }

    @Override
    public RegisteredClient findById(String id) {
        return registryAccountRepository.findById(id)
                .map(this::toRegisteredClient)
                .orElse(null);
    }

    @Override
    public RegisteredClient findByClientId(String clientId) {
        return registryAccountRepository.findByClientId(clientId)
                .map(this::toRegisteredClient)
                .orElse(null);
    }

    RegisteredClient toRegisteredClient(RegistryAccount account) {
        if (!account.isActive()) {
            log.debug("Token request for inactive account {}", account.getClientId());
            return null;
        }

        return RegisteredClient.withId(account.getId())
                .clientId(account.getClientId())
                .clientIdIssuedAt(account.getCreatedAt())
                .clientSecret(account.getClientSecret())
                .clientName(account.getClientName())
                .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_BASIC)
                .authorizationGrantType(AuthorizationGrantType.CLIENT_CREDENTIALS)
                .scope(AccountRegistrationService.REGISTRY_SCOPE)
                .clientSettings(ClientSettings.builder()
                        .requireAuthorizationConsent(false)
                        .build())
                .tokenSettings(TokenSettings.builder()
                        .accessTokenTimeToLive(Duration.parse(accessTokenTtl))
                        .build())
                .build();
    }
}
