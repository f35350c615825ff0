package com.studio45.backend.modules.notification.presentation.dto;

public record TestEmailResponse(String message, RenderedEmailResponse preview) {
}
