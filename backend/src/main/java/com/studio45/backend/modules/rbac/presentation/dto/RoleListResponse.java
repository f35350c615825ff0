package com.studio45.backend.modules.rbac.presentation.dto;

import java.util.List;

public record RoleListResponse(List<RoleResponse> roles, int total) {
}
