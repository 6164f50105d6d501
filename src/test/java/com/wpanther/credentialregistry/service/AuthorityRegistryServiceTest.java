package com.wpanther.credentialregistry.service;

import com.wpanther.credentialregistry.dto.AuthorityRegistrationRequest;
import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryErrorCode;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.AuthorityRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthorityRegistryService
 */
@ExtendWith(MockitoExtension.class)
class AuthorityRegistryServiceTest {

    @Mock
    private AuthorityRepository authorityRepository;

    @Mock
    private AdminAuthorizationService adminAuthorizationService;

    @Mock
    private CallerIdentityService callerIdentityService;

    @Mock
    private RegistryEventService registryEventService;

    @Mock
    private LedgerClock ledgerClock;

    @InjectMocks
    private AuthorityRegistryService authorityRegistryService;

    private static final String HOSPITAL = "hospital-account";
    private static final String ADMIN = "admin-account";

    @Test
    void testRegister_CreatesUnverifiedAuthority() {
        // Arrange
        RegistryAccountKey key = new RegistryAccountKey(RegistryType.PRIVILEGE, HOSPITAL);
        when(callerIdentityService.currentCaller()).thenReturn(HOSPITAL);
        when(authorityRepository.existsById(key)).thenReturn(false);
        when(ledgerClock.currentHeight()).thenReturn(10L);
        when(authorityRepository.saveAndFlush(any(Authority.class))).thenAnswer(inv -> inv.getArgument(0));

        AuthorityRegistrationRequest request = AuthorityRegistrationRequest.builder()
                .name("General Hospital")
                .website("https://general.example")
                .location("Springfield")
                .build();

        // Act
        Authority result = authorityRegistryService.register(RegistryType.PRIVILEGE, request);

        // Assert
        assertThat(result.getId()).isEqualTo(key);
        assertThat(result.getName()).isEqualTo("General Hospital");
        assertThat(result.getCategory()).isNull();
        assertThat(result.isVerified()).isFalse();
        assertThat(result.isActive()).isTrue();
        assertThat(result.getRegisteredAt()).isEqualTo(10L);

        verify(registryEventService).record(eq(RegistryType.PRIVILEGE), eq(RegistryEventService.ACTION_AUTHORITY_REGISTERED),
                eq(HOSPITAL), eq(RegistryEvent.TARGET_AUTHORITY), eq(HOSPITAL), eq("General Hospital"), eq(10L));
    }

    @Test
    void testRegister_DuplicateRejected() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(HOSPITAL);
        when(authorityRepository.existsById(new RegistryAccountKey(RegistryType.PRIVILEGE, HOSPITAL))).thenReturn(true);

        AuthorityRegistrationRequest request = AuthorityRegistrationRequest.builder().name("Renamed Hospital").build();

        // Act & Assert
        assertThatThrownBy(() -> authorityRegistryService.register(RegistryType.PRIVILEGE, request))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.ALREADY_EXISTS);

        verify(authorityRepository, never()).saveAndFlush(any(Authority.class));
        verifyNoInteractions(registryEventService);
    }

    @Test
    void testRegister_ConcurrentDuplicateReportedAsAlreadyExists() {
        // Arrange: both calls passed the existence check, this one loses the insert
        when(callerIdentityService.currentCaller()).thenReturn(HOSPITAL);
        when(authorityRepository.existsById(new RegistryAccountKey(RegistryType.PANEL, HOSPITAL))).thenReturn(false);
        when(ledgerClock.currentHeight()).thenReturn(11L);
        when(authorityRepository.saveAndFlush(any(Authority.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        AuthorityRegistrationRequest request = AuthorityRegistrationRequest.builder().name("Blue Shield").build();

        // Act & Assert
        assertThatThrownBy(() -> authorityRegistryService.register(RegistryType.PANEL, request))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.ALREADY_EXISTS);

        verifyNoInteractions(registryEventService);
    }

    @Test
    void testSetVerified_ByAdminChangesOnlyFlag() {
        // Arrange
        Authority existing = authority(RegistryType.QUALIFICATION, HOSPITAL, false);
        when(callerIdentityService.currentCaller()).thenReturn(ADMIN);
        when(authorityRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(ledgerClock.currentHeight()).thenReturn(20L);
        when(authorityRepository.save(any(Authority.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Authority result = authorityRegistryService.setVerified(RegistryType.QUALIFICATION, HOSPITAL, true);

        // Assert
        verify(adminAuthorizationService).requireAdmin(RegistryType.QUALIFICATION, ADMIN);
        assertThat(result.isVerified()).isTrue();
        assertThat(result.getName()).isEqualTo(existing.getName());
        assertThat(result.getCategory()).isEqualTo(existing.getCategory());
        assertThat(result.getRegisteredAt()).isEqualTo(existing.getRegisteredAt());
        assertThat(result.isActive()).isTrue();
    }

    @Test
    void testSetVerified_NonAdminRejected() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(HOSPITAL);
        doThrow(RegistryException.unauthorized("not an admin"))
                .when(adminAuthorizationService).requireAdmin(RegistryType.QUALIFICATION, HOSPITAL);

        // Act & Assert
        assertThatThrownBy(() -> authorityRegistryService.setVerified(RegistryType.QUALIFICATION, HOSPITAL, true))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.UNAUTHORIZED);

        verifyNoInteractions(authorityRepository);
    }

    @Test
    void testSetVerified_UnknownAuthority() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(ADMIN);
        when(authorityRepository.findById(new RegistryAccountKey(RegistryType.PANEL, "ghost"))).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> authorityRegistryService.setVerified(RegistryType.PANEL, "ghost", true))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.NOT_FOUND);
    }

    @Test
    void testRequireVerifiedAuthority() {
        // Arrange
        when(authorityRepository.findById(new RegistryAccountKey(RegistryType.PANEL, "unregistered")))
                .thenReturn(Optional.empty());
        when(authorityRepository.findById(new RegistryAccountKey(RegistryType.PANEL, "pending")))
                .thenReturn(Optional.of(authority(RegistryType.PANEL, "pending", false)));
        when(authorityRepository.findById(new RegistryAccountKey(RegistryType.PANEL, "vetted")))
                .thenReturn(Optional.of(authority(RegistryType.PANEL, "vetted", true)));

        // Act & Assert
        assertThatThrownBy(() -> authorityRegistryService.requireVerifiedAuthority(RegistryType.PANEL, "unregistered"))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> authorityRegistryService.requireVerifiedAuthority(RegistryType.PANEL, "pending"))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.UNAUTHORIZED);
        assertThat(authorityRegistryService.requireVerifiedAuthority(RegistryType.PANEL, "vetted").isVerified()).isTrue();
    }

    private Authority authority(RegistryType registry, String accountId, boolean verified) {
        return Authority.builder()
                .id(new RegistryAccountKey(registry, accountId))
                .name("Authority " + accountId)
                .category("Medical Board")
                .website("https://" + accountId + ".example")
                .location("Capital City")
                .verified(verified)
                .active(true)
                .registeredAt(5L)
                .createdAt(Instant.now())
                .build();
    }
}
