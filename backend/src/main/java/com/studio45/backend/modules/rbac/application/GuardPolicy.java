package com.studio45.backend.modules.rbac.application;

import java.util.Collection;
import java.util.UUID;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.rbac.domain.Permission;
import com.studio45.backend.modules.rbac.domain.Role;
import com.studio45.backend.modules.rbac.domain.SystemRoles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pre-flight checks that keep administrators from locking themselves or the system out.
 * Every rejection is a validation error and happens before anything is written.
 *
 * <p>The self-demotion rule only looks at the acting admin. It does not ensure another admin remains.
 */
@Component
public class GuardPolicy {

    private static final Logger log = LoggerFactory.getLogger(GuardPolicy.class);

    private final AuthorizationResolver authorizationResolver;

    public GuardPolicy(AuthorizationResolver authorizationResolver) {
        this.authorizationResolver = authorizationResolver;
    }

    public void checkRoleReplacement(UUID actorId, UUID targetUserId, Collection<String> requestedRoles) {
        if (!actorId.equals(targetUserId) || requestedRoles.contains(SystemRoles.ADMIN)) {
            return;
        }
        if (authorizationResolver.hasRole(actorId, SystemRoles.ADMIN)) {
            reject(actorId, "guard.self_demotion", "Cannot remove admin role from yourself");
        }
    }

    public void checkUserDeletion(UUID actorId, UUID targetUserId) {
        if (actorId.equals(targetUserId)) {
            reject(actorId, "guard.self_deletion", "Cannot delete yourself");
        }
    }

    public void checkRoleDeletion(UUID actorId, Role role) {
        if (role.isSystemRole()) {
            reject(actorId, "guard.system_role", "cannot delete system role: " + role.getName());
        }
    }

    public void checkRoleRename(UUID actorId, Role role, String newName) {
        if (role.isSystemRole() && !role.getName().equals(newName)) {
            reject(actorId, "guard.system_role", "cannot rename system role: " + role.getName());
        }
    }

    /**
     * Compares the requested permission set for {@code role} against the admin-panel permission.
     */
    public void checkRolePermissionReplacement(UUID actorId, Role role, Collection<Permission> requestedPermissions) {
        if (!SystemRoles.ADMIN.equals(role.getName())) {
            return;
        }
        boolean keepsAdminAccess = requestedPermissions.stream()
                .anyMatch(permission -> SystemRoles.ADMIN_ACCESS.equals(permission.getName()));
        if (!keepsAdminAccess) {
            reject(actorId, "guard.critical_permission",
                    "cannot remove " + SystemRoles.ADMIN_ACCESS + " permission from " + SystemRoles.ADMIN + " role");
        }
    }

    /**
     * Renaming the admin-panel permission would strip it from the admin role by name.
     */
    public void checkPermissionRename(UUID actorId, Permission permission, String newName) {
        if (SystemRoles.ADMIN_ACCESS.equals(permission.getName()) && !permission.getName().equals(newName)) {
            reject(actorId, "guard.critical_permission", "cannot rename " + SystemRoles.ADMIN_ACCESS + " permission");
        }
    }

    public void checkPermissionDeletion(UUID actorId, Permission permission) {
        if (SystemRoles.ADMIN_ACCESS.equals(permission.getName())) {
            reject(actorId, "guard.critical_permission", "cannot delete " + SystemRoles.ADMIN_ACCESS + " permission");
        }
    }

    private void reject(UUID actorId, String code, String message) {
        log.warn("Guard rejected action by {}: {}", actorId, message);
        throw ProblemException.validation(code, message);
    }
}
