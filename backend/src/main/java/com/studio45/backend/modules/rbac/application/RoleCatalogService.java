package com.studio45.backend.modules.rbac.application;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.rbac.domain.Permission;
import com.studio45.backend.modules.rbac.domain.Role;
import com.studio45.backend.modules.rbac.domain.RoleUpdate;
import com.studio45.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.studio45.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.studio45.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.studio45.backend.modules.rbac.presentation.dto.RoleResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RoleCatalogService {

    private static final Logger log = LoggerFactory.getLogger(RoleCatalogService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final GuardPolicy guardPolicy;

    public RoleCatalogService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            UserRoleRepository userRoleRepository,
            GuardPolicy guardPolicy
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.userRoleRepository = userRoleRepository;
        this.guardPolicy = guardPolicy;
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        return roleRepository.findAllByOrderByNameAsc().stream()
                .map(RoleResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(@NonNull UUID roleId) {
        return RoleResponse.from(findRoleWithPermissions(roleId));
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> getRolePermissions(@NonNull UUID roleId) {
        return findRoleWithPermissions(roleId).getPermissionsSortedByName().stream()
                .map(PermissionResponse::from)
                .toList();
    }

    public RoleResponse createRole(@NonNull CreateRoleCommand command) {
        String name = command.name().trim();
        if (roleRepository.existsByName(name)) {
            throw ProblemException.conflict("rbac.role_exists", "Role name already exists");
        }
        Role role = roleRepository.save(new Role(name, blankToNull(command.description())));
        log.info("Role {} created", name);
        return RoleResponse.from(role);
    }

    public RoleResponse updateRole(@NonNull UUID actorId, @NonNull UUID roleId, @NonNull List<RoleUpdate> updates) {
        if (updates.isEmpty()) {
            throw ProblemException.validation("rbac.no_fields", "No fields to update");
        }
        Role role = findRoleWithPermissions(roleId);
        for (RoleUpdate update : updates) {
            if (update instanceof RoleUpdate.NameUpdate nameUpdate) {
                guardPolicy.checkRoleRename(actorId, role, nameUpdate.name());
                if (roleRepository.existsByNameAndIdNot(nameUpdate.name(), roleId)) {
                    throw ProblemException.conflict("rbac.role_exists", "Role name already exists");
                }
            }
        }
        updates.forEach(update -> update.applyTo(role));
        return RoleResponse.from(roleRepository.saveAndFlush(role));
    }

    public void deleteRole(@NonNull UUID actorId, @NonNull UUID roleId) {
        Role role = findRole(roleId);
        guardPolicy.checkRoleDeletion(actorId, role);
        String name = role.getName();
        int revoked = userRoleRepository.deleteAllForRole(roleId);
        roleRepository.deleteById(roleId);
        log.info("Role {} deleted by {} ({} grant(s) removed)", name, actorId, revoked);
    }

    /**
     * Replaces the role's permission set in one transaction. Unknown ids abort before any link changes.
     */
    public RoleResponse replacePermissions(@NonNull UUID actorId, @NonNull UUID roleId, @NonNull List<UUID> permissionIds) {
        Role role = findRoleWithPermissions(roleId);
        Set<UUID> requested = new LinkedHashSet<>(permissionIds);

        Map<UUID, Permission> found = permissionRepository.findAllById(requested).stream()
                .collect(Collectors.toMap(Permission::getId, Function.identity()));
        for (UUID id : requested) {
            if (!found.containsKey(id)) {
                throw ProblemException.validation("rbac.permission_not_found", "permission not found: " + id);
            }
        }

        List<Permission> replacement = requested.stream().map(found::get).toList();
        guardPolicy.checkRolePermissionReplacement(actorId, role, replacement);

        role.replacePermissions(replacement);
        Role saved = roleRepository.saveAndFlush(role);
        log.info("Permissions of role {} replaced by {} ({} permission(s))", role.getName(), actorId, replacement.size());
        return RoleResponse.from(saved);
    }

    private Role findRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("rbac.role_not_found", "Role not found"));
    }

    private Role findRoleWithPermissions(UUID roleId) {
        return roleRepository.findWithPermissionsById(roleId)
                .orElseThrow(() -> ProblemException.notFound("rbac.role_not_found", "Role not found"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record CreateRoleCommand(String name, String description) {
    }
}
