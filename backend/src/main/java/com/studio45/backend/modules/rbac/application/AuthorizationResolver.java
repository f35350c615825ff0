package com.studio45.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.rbac.domain.Permission;
import com.studio45.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.studio45.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers "what can this user do right now" from the catalog. Grants past their expiry are ignored.
 */
@Service
@Transactional(readOnly = true)
public class AuthorizationResolver {

    private final UserRoleRepository userRoleRepository;
    private final PermissionRepository permissionRepository;
    private final Clock clock;

    public AuthorizationResolver(
            UserRoleRepository userRoleRepository,
            PermissionRepository permissionRepository,
            Clock clock
    ) {
        this.userRoleRepository = userRoleRepository;
        this.permissionRepository = permissionRepository;
        this.clock = clock;
    }

    public List<String> getRoleNames(UUID userId) {
        return userRoleRepository.findActiveRoleNames(userId, OffsetDateTime.now(clock));
    }

    public List<Permission> getPermissions(UUID userId) {
        return permissionRepository.findEffectiveForUser(userId, OffsetDateTime.now(clock));
    }

    public boolean hasPermission(UUID userId, String permissionName) {
        if (permissionName == null || permissionName.isBlank()) {
            return false;
        }
        return permissionRepository.countEffectiveForUser(userId, permissionName, OffsetDateTime.now(clock)) > 0;
    }

    public boolean hasRole(UUID userId, String roleName) {
        return getRoleNames(userId).contains(roleName);
    }
}
