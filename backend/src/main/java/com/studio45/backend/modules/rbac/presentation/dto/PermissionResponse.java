package com.studio45.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.studio45.backend.modules.rbac.domain.Permission;

public record PermissionResponse(
        UUID id,
        String name,
        String resource,
        String action,
        String description,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getResource(),
                permission.getAction(),
                permission.getDescription(),
                permission.getCreatedAt(),
                permission.getUpdatedAt()
        );
    }
}
