package com.studio45.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.studio45.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationResolverTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    private AuthorizationResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AuthorizationResolver(userRoleRepository, permissionRepository, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void roleLookupUsesCurrentTimeForExpiry() {
        when(userRoleRepository.findActiveRoleNames(USER_ID, NOW)).thenReturn(List.of("premium", "user"));

        assertThat(resolver.hasRole(USER_ID, "premium")).isTrue();
        assertThat(resolver.hasRole(USER_ID, "admin")).isFalse();
    }

    @Test
    void permissionCheckCountsEffectiveGrants() {
        when(permissionRepository.countEffectiveForUser(USER_ID, "premium.access", NOW)).thenReturn(1L);
        when(permissionRepository.countEffectiveForUser(USER_ID, "admin.access", NOW)).thenReturn(0L);

        assertThat(resolver.hasPermission(USER_ID, "premium.access")).isTrue();
        assertThat(resolver.hasPermission(USER_ID, "admin.access")).isFalse();
    }

    @Test
    void blankPermissionNameIsNeverGranted() {
        assertThat(resolver.hasPermission(USER_ID, " ")).isFalse();
        assertThat(resolver.hasPermission(USER_ID, null)).isFalse();
        verify(permissionRepository, never()).countEffectiveForUser(any(), anyString(), eq(NOW));
    }
}
