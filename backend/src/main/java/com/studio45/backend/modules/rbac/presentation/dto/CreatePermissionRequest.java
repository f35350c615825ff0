package com.studio45.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "name is required") @Size(min = 3, max = 100) String name,
        @NotBlank(message = "resource is required") @Size(min = 2, max = 100) String resource,
        @NotBlank(message = "action is required") @Size(min = 2, max = 50) String action,
        String description
) {
}
