package com.studio45.backend.modules.notification.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

public record PreviewEmailTemplateRequest(
        @NotNull(message = "variables is required") Map<String, String> variables
) {
}
