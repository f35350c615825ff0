package com.studio45.backend.modules.rbac.presentation.dto;

import java.util.List;

public record PermissionListResponse(List<PermissionResponse> permissions, int total) {
}
