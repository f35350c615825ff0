package com.studio45.backend.modules.notification.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TestEmailTemplateRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotNull(message = "variables is required") Map<String, String> variables
) {
}
