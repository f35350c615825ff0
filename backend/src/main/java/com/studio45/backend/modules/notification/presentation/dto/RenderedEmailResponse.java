package com.studio45.backend.modules.notification.presentation.dto;

import com.studio45.backend.modules.notification.domain.RenderedEmail;

public record RenderedEmailResponse(String subject, String htmlContent, String textContent) {

    public static RenderedEmailResponse from(RenderedEmail rendered) {
        return new RenderedEmailResponse(rendered.subject(), rendered.htmlContent(), rendered.textContent());
    }
}
