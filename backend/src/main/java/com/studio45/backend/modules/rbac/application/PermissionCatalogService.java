package com.studio45.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.rbac.domain.Permission;
import com.studio45.backend.modules.rbac.domain.PermissionUpdate;
import com.studio45.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PermissionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalogService.class);

    private final PermissionRepository permissionRepository;
    private final GuardPolicy guardPolicy;

    public PermissionCatalogService(PermissionRepository permissionRepository, GuardPolicy guardPolicy) {
        this.permissionRepository = permissionRepository;
        this.guardPolicy = guardPolicy;
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissions() {
        return permissionRepository.findAllByOrderByResourceAscActionAsc().stream()
                .map(PermissionResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PermissionResponse getPermission(@NonNull UUID permissionId) {
        return PermissionResponse.from(findPermission(permissionId));
    }

    public PermissionResponse createPermission(@NonNull CreatePermissionCommand command) {
        String name = command.name().trim();
        if (permissionRepository.existsByName(name)) {
            throw ProblemException.conflict("rbac.permission_exists", "Permission name already exists");
        }
        Permission permission = new Permission(
                name,
                command.resource().trim(),
                command.action().trim(),
                command.description() == null || command.description().isBlank() ? null : command.description().trim()
        );
        Permission saved = permissionRepository.save(permission);
        log.info("Permission {} created", name);
        return PermissionResponse.from(saved);
    }

    public PermissionResponse updatePermission(
            @NonNull UUID actorId,
            @NonNull UUID permissionId,
            @NonNull List<PermissionUpdate> updates
    ) {
        if (updates.isEmpty()) {
            throw ProblemException.validation("rbac.no_fields", "No fields to update");
        }
        Permission permission = findPermission(permissionId);
        for (PermissionUpdate update : updates) {
            if (update instanceof PermissionUpdate.NameUpdate nameUpdate) {
                guardPolicy.checkPermissionRename(actorId, permission, nameUpdate.name());
                if (permissionRepository.existsByNameAndIdNot(nameUpdate.name(), permissionId)) {
                    throw ProblemException.conflict("rbac.permission_exists", "Permission name already exists");
                }
            }
        }
        updates.forEach(update -> update.applyTo(permission));
        return PermissionResponse.from(permissionRepository.saveAndFlush(permission));
    }

    /**
     * Removes the permission and every role link to it.
     */
    public void deletePermission(@NonNull UUID actorId, @NonNull UUID permissionId) {
        Permission permission = findPermission(permissionId);
        guardPolicy.checkPermissionDeletion(actorId, permission);
        String name = permission.getName();
        int links = permissionRepository.deleteRoleLinks(permissionId);
        permissionRepository.deleteById(permissionId);
        log.info("Permission {} deleted by {} ({} role link(s) removed)", name, actorId, links);
    }

    private Permission findPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("rbac.permission_not_found", "Permission not found"));
    }

    public record CreatePermissionCommand(String name, String resource, String action, String description) {
    }
}
