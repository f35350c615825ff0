package com.studio45.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "name is required") @Size(min = 2, max = 50) String name,
        String description
) {
}
