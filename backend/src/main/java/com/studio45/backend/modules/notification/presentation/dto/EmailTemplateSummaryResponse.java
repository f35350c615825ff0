package com.studio45.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.notification.domain.EmailTemplate;
import com.studio45.backend.modules.notification.domain.TemplateVariable;

/**
 * List entry without the template bodies.
 */
public record EmailTemplateSummaryResponse(
        UUID id,
        String name,
        String subject,
        List<TemplateVariable> variables,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmailTemplateSummaryResponse from(EmailTemplate template) {
        return new EmailTemplateSummaryResponse(
                template.getId(),
                template.getName(),
                template.getSubject(),
                template.getVariables(),
                template.isActive(),
                template.getCreatedAt(),
                template.getUpdatedAt()
        );
    }
}
