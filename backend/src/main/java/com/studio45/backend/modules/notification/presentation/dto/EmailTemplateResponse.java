package com.studio45.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.notification.domain.EmailTemplate;
import com.studio45.backend.modules.notification.domain.TemplateVariable;

public record EmailTemplateResponse(
        UUID id,
        String name,
        String subject,
        String htmlTemplate,
        String textTemplate,
        List<TemplateVariable> variables,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmailTemplateResponse from(EmailTemplate template) {
        return new EmailTemplateResponse(
                template.getId(),
                template.getName(),
                template.getSubject(),
                template.getHtmlTemplate(),
                template.getTextTemplate(),
                template.getVariables(),
                template.isActive(),
                template.getCreatedAt(),
                template.getUpdatedAt()
        );
    }
}
