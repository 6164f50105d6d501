package com.wpanther.credentialregistry.service;

import com.wpanther.credentialregistry.dto.AccountRegistrationRequest;
import com.wpanther.credentialregistry.dto.AccountRegistrationResponse;
import com.wpanther.credentialregistry.entity.RegistryAccount;
import com.wpanther.credentialregistry.exception.AccountRegistrationException;
import com.wpanther.credentialregistry.repository.RegistryAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.security.SecureRandom;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountRegistrationService
 */
@ExtendWith(MockitoExtension.class)
public class AccountRegistrationServiceTest {

    @Mock
    private RegistryAccountRepository registryAccountRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private AccountRegistrationService accountRegistrationService;

    @BeforeEach
    public void setUp() {
        accountRegistrationService = new AccountRegistrationService(
                registryAccountRepository, passwordEncoder, new SecureRandom());
    }

    private AccountRegistrationRequest request(Set<String> scopes, Set<String> grantTypes) {
        AccountRegistrationRequest request = new AccountRegistrationRequest();
        request.setClientName("General Hospital");
        request.setScopes(scopes);
        request.setGrantTypes(grantTypes);
        return request;
    }

    @Test
    public void testRegisterAccount_StoresHashedSecretAndRegistryScope() {
        // Arrange
        when(passwordEncoder.encode(anyString())).thenAnswer(inv -> "hashed:" + inv.getArgument(0));
        when(registryAccountRepository.save(any(RegistryAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        AccountRegistrationResponse response = accountRegistrationService.registerAccount(
                request(Set.of("registry"), Set.of("client_credentials")));

        // Assert
        assertNotNull(response.getClientId());
        assertNotNull(response.getClientSecret());
        assertEquals("General Hospital", response.getClientName());
        assertEquals(Set.of("registry"), response.getScopes());
        assertEquals(Set.of("client_credentials"), response.getGrantTypes());

        ArgumentCaptor<RegistryAccount> captor = ArgumentCaptor.forClass(RegistryAccount.class);
        verify(registryAccountRepository).save(captor.capture());
        RegistryAccount stored = captor.getValue();
        assertEquals("hashed:" + response.getClientSecret(), stored.getClientSecret());
        assertEquals(response.getClientId(), stored.getClientId());
        assertEquals(Set.of(AccountRegistrationService.REGISTRY_SCOPE), stored.getScopes());
        assertTrue(stored.isActive());
    }

    @Test
    public void testRegisterAccount_WithoutScopesStillGetsRegistryScope() {
        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        when(registryAccountRepository.save(any(RegistryAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        AccountRegistrationResponse response = accountRegistrationService.registerAccount(
                request(null, Set.of("client_credentials")));

        assertEquals(Set.of("registry"), response.getScopes());
    }

    @Test
    public void testRegisterAccount_SecretsDifferPerAccount() {
        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        when(registryAccountRepository.save(any(RegistryAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        AccountRegistrationResponse first = accountRegistrationService.registerAccount(
                request(Set.of("registry"), Set.of("client_credentials")));
        AccountRegistrationResponse second = accountRegistrationService.registerAccount(
                request(Set.of("registry"), Set.of("client_credentials")));

        assertNotEquals(first.getClientSecret(), second.getClientSecret());
        assertNotEquals(first.getClientId(), second.getClientId());
    }

    @Test
    public void testRegisterAccount_OtherScopeRejected() {
        AccountRegistrationException e = assertThrows(AccountRegistrationException.class,
                () -> accountRegistrationService.registerAccount(
                        request(Set.of("registry", "admin"), Set.of("client_credentials"))));

        assertEquals("Accounts may only request the registry scope", e.getMessage());
        verifyNoInteractions(registryAccountRepository, passwordEncoder);
    }

    @Test
    public void testRegisterAccount_UnsupportedGrantType() {
        AccountRegistrationException e = assertThrows(AccountRegistrationException.class,
                () -> accountRegistrationService.registerAccount(
                        request(Set.of("registry"), Set.of("authorization_code"))));

        assertEquals("Only client_credentials grant type is supported", e.getMessage());
        verifyNoInteractions(registryAccountRepository);
    }

    @Test
    public void testRegisterAccount_ExtraGrantTypeRejected() {
        assertThrows(AccountRegistrationException.class,
                () -> accountRegistrationService.registerAccount(
                        request(Set.of("registry"), Set.of("client_credentials", "refresh_token"))));
        verifyNoInteractions(registryAccountRepository);
    }

    @Test
    public void testEnsureAccount_ExistingAccountUntouched() {
        when(registryAccountRepository.existsByClientId("registry-owner")).thenReturn(true);

        assertFalse(accountRegistrationService.ensureAccount("registry-owner", "secret", "Registry Owner"));
        verify(registryAccountRepository, never()).save(any(RegistryAccount.class));
        verifyNoInteractions(passwordEncoder);
    }

    @Test
    public void testEnsureAccount_CreatesWithConfiguredClientId() {
        when(registryAccountRepository.existsByClientId("registry-owner")).thenReturn(false);
        when(passwordEncoder.encode("secret")).thenReturn("hashed");
        when(registryAccountRepository.save(any(RegistryAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        assertTrue(accountRegistrationService.ensureAccount("registry-owner", "secret", "Registry Owner"));

        ArgumentCaptor<RegistryAccount> captor = ArgumentCaptor.forClass(RegistryAccount.class);
        verify(registryAccountRepository).save(captor.capture());
        assertEquals("registry-owner", captor.getValue().getClientId());
        assertEquals("hashed", captor.getValue().getClientSecret());
        assertEquals(Set.of(AccountRegistrationService.GRANT_CLIENT_CREDENTIALS), captor.getValue().getGrantTypes());
    }
}
