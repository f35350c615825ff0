package com.studio45.backend.modules.notification.presentation.dto;

import java.util.List;

public record EmailTemplateListResponse(List<EmailTemplateSummaryResponse> templates, int total) {
}
