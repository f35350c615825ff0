package com.studio45.backend.modules.notification.domain;

import java.util.Objects;

/**
 * The three renderable parts of an email template.
 */
public record TemplateContent(String subject, String htmlTemplate, String textTemplate) {

    public TemplateContent {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(htmlTemplate, "htmlTemplate");
        Objects.requireNonNull(textTemplate, "textTemplate");
    }
}
