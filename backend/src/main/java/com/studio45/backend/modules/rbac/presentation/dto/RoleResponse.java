package com.studio45.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.rbac.domain.Role;

public record RoleResponse(
        UUID id,
        String name,
        String description,
        boolean systemRole,
        List<PermissionResponse> permissions,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.isSystemRole(),
                role.getPermissionsSortedByName().stream().map(PermissionResponse::from).toList(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}
