package com.studio45.backend.modules.notification.infrastructure.template;

import java.util.Map;
import java.util.Optional;

import com.studio45.backend.modules.notification.application.TemplateRenderer;
import com.studio45.backend.modules.notification.application.TemplateSource;
import com.studio45.backend.modules.notification.domain.RenderedEmail;
import com.studio45.backend.modules.notification.infrastructure.persistence.EmailTemplateRepository;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Active, non-deleted templates managed through the admin API.
 */
@Component
@Order(0)
public class DatabaseTemplateSource implements TemplateSource {

    private final EmailTemplateRepository emailTemplateRepository;
    private final TemplateRenderer templateRenderer;

    public DatabaseTemplateSource(EmailTemplateRepository emailTemplateRepository, TemplateRenderer templateRenderer) {
        this.emailTemplateRepository = emailTemplateRepository;
        this.templateRenderer = templateRenderer;
    }

    @Override
    public String sourceName() {
        return "database";
    }

    @Override
    public Optional<RenderedEmail> render(String templateName, Map<String, String> variables) {
        return emailTemplateRepository.findByNameAndActiveTrue(templateName)
                .map(template -> templateRenderer.render(template.toContent(), variables));
    }
}
