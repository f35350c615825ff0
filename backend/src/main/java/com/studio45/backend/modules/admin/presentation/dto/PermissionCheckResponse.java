package com.studio45.backend.modules.admin.presentation.dto;

import java.util.UUID;

public record PermissionCheckResponse(UUID userId, String permission, boolean hasPermission) {
}
