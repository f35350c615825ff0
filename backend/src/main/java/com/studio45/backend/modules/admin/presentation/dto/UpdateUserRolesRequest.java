package com.studio45.backend.modules.admin.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

public record UpdateUserRolesRequest(
        @NotEmpty(message = "roles must contain at least one role") List<@NotBlank String> roles
) {
}
