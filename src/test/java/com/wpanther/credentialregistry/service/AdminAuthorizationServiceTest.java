package com.wpanther.credentialregistry.service;

import com.wpanther.credentialregistry.entity.AdminGrant;
import com.wpanther.credentialregistry.entity.RegistryAccountKey;
import com.wpanther.credentialregistry.entity.RegistryEvent;
import com.wpanther.credentialregistry.entity.RegistryType;
import com.wpanther.credentialregistry.exception.RegistryErrorCode;
import com.wpanther.credentialregistry.exception.RegistryException;
import com.wpanther.credentialregistry.repository.AdminGrantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AdminAuthorizationService
 */
@ExtendWith(MockitoExtension.class)
class AdminAuthorizationServiceTest {

    @Mock
    private AdminGrantRepository adminGrantRepository;

    @Mock
    private CallerIdentityService callerIdentityService;

    @Mock
    private RegistryEventService registryEventService;

    @Mock
    private LedgerClock ledgerClock;

    @InjectMocks
    private AdminAuthorizationService adminAuthorizationService;

    private static final String OWNER = "owner-account";
    private static final String ADMIN = "admin-account";

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(adminAuthorizationService, "ownerId", OWNER);
    }

    @Test
    void testAddAdmin_ByOwner() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(OWNER);
        when(ledgerClock.currentHeight()).thenReturn(42L);

        // Act
        adminAuthorizationService.addAdmin(RegistryType.PRIVILEGE, ADMIN);

        // Assert
        ArgumentCaptor<AdminGrant> captor = ArgumentCaptor.forClass(AdminGrant.class);
        verify(adminGrantRepository).saveAndFlush(captor.capture());

        AdminGrant saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo(new RegistryAccountKey(RegistryType.PRIVILEGE, ADMIN));
        assertThat(saved.isAuthorized()).isTrue();
        assertThat(saved.getGrantedBy()).isEqualTo(OWNER);

        verify(registryEventService).record(eq(RegistryType.PRIVILEGE), eq(RegistryEventService.ACTION_ADMIN_ADDED),
                eq(OWNER), eq(RegistryEvent.TARGET_ADMIN), eq(ADMIN), isNull(), eq(42L));
    }

    @Test
    void testAddAdmin_NonOwnerRejected() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(ADMIN);

        // Act & Assert
        assertThatThrownBy(() -> adminAuthorizationService.addAdmin(RegistryType.PRIVILEGE, "someone-else"))
                .isInstanceOf(RegistryException.class)
                .extracting(ex -> ((RegistryException) ex).getCode())
                .isEqualTo(RegistryErrorCode.UNAUTHORIZED);

        verify(adminGrantRepository, never()).saveAndFlush(any(AdminGrant.class));
        verify(registryEventService, never()).record(any(), anyString(), anyString(), anyString(), anyString(), any(), anyLong());
    }

    @Test
    void testRemoveAdmin_ClearsFlag() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(OWNER);
        when(ledgerClock.currentHeight()).thenReturn(7L);

        // Act
        adminAuthorizationService.removeAdmin(RegistryType.QUALIFICATION, ADMIN);

        // Assert
        ArgumentCaptor<AdminGrant> captor = ArgumentCaptor.forClass(AdminGrant.class);
        verify(adminGrantRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().isAuthorized()).isFalse();
        verify(registryEventService).record(eq(RegistryType.QUALIFICATION), eq(RegistryEventService.ACTION_ADMIN_REMOVED),
                eq(OWNER), eq(RegistryEvent.TARGET_ADMIN), eq(ADMIN), isNull(), eq(7L));
    }

    @Test
    void testRemoveAdmin_UpdatesStoredGrantUnderItsVersion() {
        // Arrange
        AdminGrant stored = grant(RegistryType.PANEL, ADMIN, true);
        stored.setVersion(3L);
        when(callerIdentityService.currentCaller()).thenReturn(OWNER);
        when(ledgerClock.currentHeight()).thenReturn(8L);
        when(adminGrantRepository.findById(stored.getId())).thenReturn(Optional.of(stored));

        // Act
        adminAuthorizationService.removeAdmin(RegistryType.PANEL, ADMIN);

        // Assert
        ArgumentCaptor<AdminGrant> captor = ArgumentCaptor.forClass(AdminGrant.class);
        verify(adminGrantRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().isAuthorized()).isFalse();
        assertThat(captor.getValue().getVersion()).isEqualTo(3L);
    }

    @Test
    void testAddAdmin_NewGrantIsInsertedWithoutVersion() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(OWNER);
        when(ledgerClock.currentHeight()).thenReturn(9L);
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.PANEL, ADMIN))).thenReturn(Optional.empty());

        // Act
        adminAuthorizationService.addAdmin(RegistryType.PANEL, ADMIN);

        // Assert
        ArgumentCaptor<AdminGrant> captor = ArgumentCaptor.forClass(AdminGrant.class);
        verify(adminGrantRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getVersion()).isNull();
    }

    @Test
    void testAddAdmin_ConcurrentInsertRollsBackCall() {
        // Arrange: another call inserted the same grant first
        when(callerIdentityService.currentCaller()).thenReturn(OWNER);
        when(ledgerClock.currentHeight()).thenReturn(9L);
        when(adminGrantRepository.saveAndFlush(any(AdminGrant.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        // Act & Assert
        assertThatThrownBy(() -> adminAuthorizationService.addAdmin(RegistryType.PANEL, ADMIN))
                .isInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(registryEventService);
    }

    @Test
    void testRemoveAdmin_AdminCannotRemoveOtherAdmins() {
        // Arrange
        when(callerIdentityService.currentCaller()).thenReturn(ADMIN);

        // Act & Assert
        assertThatThrownBy(() -> adminAuthorizationService.removeAdmin(RegistryType.PANEL, "other-admin"))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("owner");

        verifyNoInteractions(adminGrantRepository);
    }

    @Test
    void testIsAdmin_UnknownAccountDefaultsToFalse() {
        // Arrange
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.PANEL, "stranger")))
                .thenReturn(Optional.empty());

        // Act & Assert
        assertThat(adminAuthorizationService.isAdmin(RegistryType.PANEL, "stranger")).isFalse();
    }

    @Test
    void testIsAdmin_IsScopedToRegistry() {
        // Arrange
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.PANEL, ADMIN)))
                .thenReturn(Optional.of(grant(RegistryType.PANEL, ADMIN, true)));
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.PRIVILEGE, ADMIN)))
                .thenReturn(Optional.empty());

        // Act & Assert
        assertThat(adminAuthorizationService.isAdmin(RegistryType.PANEL, ADMIN)).isTrue();
        assertThat(adminAuthorizationService.isAdmin(RegistryType.PRIVILEGE, ADMIN)).isFalse();
    }

    @Test
    void testIsAdmin_RevokedGrant() {
        // Arrange
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.PANEL, ADMIN)))
                .thenReturn(Optional.of(grant(RegistryType.PANEL, ADMIN, false)));

        // Act & Assert
        assertThat(adminAuthorizationService.isAdmin(RegistryType.PANEL, ADMIN)).isFalse();
    }

    @Test
    void testOwnerIsNotImplicitlyAdmin() {
        // Arrange
        when(adminGrantRepository.findById(new RegistryAccountKey(RegistryType.QUALIFICATION, OWNER)))
                .thenReturn(Optional.empty());

        // Act & Assert
        assertThat(adminAuthorizationService.isOwner(OWNER)).isTrue();
        assertThat(adminAuthorizationService.isAdmin(RegistryType.QUALIFICATION, OWNER)).isFalse();
        assertThatThrownBy(() -> adminAuthorizationService.requireAdmin(RegistryType.QUALIFICATION, OWNER))
                .isInstanceOf(RegistryException.class);
    }

    @Test
    void testListAdmins() {
        // Arrange
        when(adminGrantRepository.findByIdRegistryAndAuthorizedTrue(RegistryType.PRIVILEGE))
                .thenReturn(List.of(grant(RegistryType.PRIVILEGE, "a1", true), grant(RegistryType.PRIVILEGE, "a2", true)));

        // Act & Assert
        assertThat(adminAuthorizationService.listAdmins(RegistryType.PRIVILEGE)).containsExactly("a1", "a2");
    }

    private AdminGrant grant(RegistryType registry, String accountId, boolean authorized) {
        return AdminGrant.builder()
                .id(new RegistryAccountKey(registry, accountId))
                .authorized(authorized)
                .grantedBy(OWNER)
                .updatedAt(Instant.now())
                .build();
    }
}
