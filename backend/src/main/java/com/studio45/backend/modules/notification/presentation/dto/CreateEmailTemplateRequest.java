package com.studio45.backend.modules.notification.presentation.dto;

import java.util.List;

import com.studio45.backend.modules.notification.domain.TemplateVariable;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateEmailTemplateRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotBlank(message = "subject is required") @Size(max = 500) String subject,
        @NotBlank(message = "htmlTemplate is required") String htmlTemplate,
        @NotBlank(message = "textTemplate is required") String textTemplate,
        List<TemplateVariable> variables,
        Boolean active
) {
}
