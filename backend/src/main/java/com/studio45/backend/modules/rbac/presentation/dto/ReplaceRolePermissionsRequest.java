package com.studio45.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record ReplaceRolePermissionsRequest(
        @NotEmpty(message = "permissionIds must contain at least one id") List<@NotNull UUID> permissionIds
) {
}
