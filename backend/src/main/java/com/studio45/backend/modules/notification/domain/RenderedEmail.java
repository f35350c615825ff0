package com.studio45.backend.modules.notification.domain;

public record RenderedEmail(String subject, String htmlContent, String textContent) {
}
