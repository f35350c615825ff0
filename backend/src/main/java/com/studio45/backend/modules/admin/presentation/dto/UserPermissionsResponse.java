package com.studio45.backend.modules.admin.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;

public record UserPermissionsResponse(UUID userId, List<PermissionResponse> permissions) {
}
