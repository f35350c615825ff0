package com.studio45.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.notification.domain.EmailTemplate;
import com.studio45.backend.modules.notification.domain.EmailTemplateUpdate;
import com.studio45.backend.modules.notification.domain.OutgoingEmail;
import com.studio45.backend.modules.notification.domain.RenderedEmail;
import com.studio45.backend.modules.notification.domain.TemplateVariable;
import com.studio45.backend.modules.notification.infrastructure.persistence.EmailTemplateRepository;
import com.studio45.backend.modules.notification.presentation.dto.EmailTemplateResponse;
import com.studio45.backend.modules.notification.presentation.dto.EmailTemplateSummaryResponse;
import com.studio45.backend.modules.notification.presentation.dto.RenderedEmailResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EmailTemplateService {

    private static final Logger log = LoggerFactory.getLogger(EmailTemplateService.class);
    private static final String NOT_FOUND = "Email template not found";

    private final EmailTemplateRepository emailTemplateRepository;
    private final TemplateRenderer templateRenderer;
    private final MailSender mailSender;
    private final String fromAddress;
    private final Clock clock;

    public EmailTemplateService(
            EmailTemplateRepository emailTemplateRepository,
            TemplateRenderer templateRenderer,
            MailSender mailSender,
            @Value("${app.mail.from:no-reply@studio45.local}") String fromAddress,
            Clock clock
    ) {
        this.emailTemplateRepository = emailTemplateRepository;
        this.templateRenderer = templateRenderer;
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<EmailTemplateSummaryResponse> listTemplates() {
        return emailTemplateRepository.findAllByOrderByNameAsc().stream()
                .map(EmailTemplateSummaryResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public EmailTemplateResponse getTemplate(@NonNull UUID templateId) {
        return EmailTemplateResponse.from(findTemplate(templateId));
    }

    /**
     * Persists a template after a dry-run render proves all three parts parse.
     */
    public EmailTemplateResponse createTemplate(@NonNull CreateEmailTemplateCommand command) {
        String name = command.name().trim();
        if (emailTemplateRepository.existsByNameIncludingDeleted(name)) {
            throw ProblemException.conflict("notification.template_exists", "Email template name already exists");
        }
        EmailTemplate template = new EmailTemplate(name, command.subject(), command.htmlTemplate(), command.textTemplate());
        template.setVariables(command.variables());
        if (command.active() != null) {
            template.setActive(command.active());
        }
        templateRenderer.validate(template.toContent(), template.getVariables());

        EmailTemplate saved = emailTemplateRepository.save(template);
        log.info("Email template {} created", name);
        return EmailTemplateResponse.from(saved);
    }

    public EmailTemplateResponse updateTemplate(@NonNull UUID templateId, @NonNull List<EmailTemplateUpdate> updates) {
        if (updates.isEmpty()) {
            throw ProblemException.validation("notification.no_fields", "No fields to update");
        }
        EmailTemplate template = findTemplate(templateId);
        for (EmailTemplateUpdate update : updates) {
            if (update instanceof EmailTemplateUpdate.NameUpdate nameUpdate
                    && emailTemplateRepository.existsByNameForOtherTemplate(nameUpdate.name(), templateId)) {
                throw ProblemException.conflict("notification.template_exists", "Email template name already exists");
            }
        }
        updates.forEach(update -> update.applyTo(template));
        templateRenderer.validate(template.toContent(), template.getVariables());

        EmailTemplate saved = emailTemplateRepository.saveAndFlush(template);
        log.info("Email template {} updated", saved.getName());
        return EmailTemplateResponse.from(saved);
    }

    public void deleteTemplate(@NonNull UUID templateId) {
        EmailTemplate template = findTemplate(templateId);
        template.markDeleted(OffsetDateTime.now(clock));
        emailTemplateRepository.save(template);
        log.info("Email template {} deleted", template.getName());
    }

    @Transactional(readOnly = true)
    public RenderedEmailResponse previewTemplate(@NonNull UUID templateId, @NonNull Map<String, String> variables) {
        EmailTemplate template = findTemplate(templateId);
        return RenderedEmailResponse.from(templateRenderer.render(template.toContent(), variables));
    }

    /**
     * Renders the template with the given values and hands it to the configured {@link MailSender}.
     */
    @Transactional(readOnly = true)
    public RenderedEmailResponse sendTestEmail(
            @NonNull UUID templateId,
            @NonNull String recipient,
            @NonNull Map<String, String> variables
    ) {
        EmailTemplate template = findTemplate(templateId);
        RenderedEmail rendered = templateRenderer.render(template.toContent(), variables);
        mailSender.send(new OutgoingEmail(fromAddress, recipient, rendered));
        log.info("Test email for template {} sent", template.getName());
        return RenderedEmailResponse.from(rendered);
    }

    @Transactional(readOnly = true)
    public List<TemplateVariable> getTemplateVariables(@NonNull UUID templateId) {
        return findTemplate(templateId).getVariables();
    }

    private EmailTemplate findTemplate(UUID templateId) {
        return emailTemplateRepository.findById(templateId)
                .filter(template -> !template.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("notification.template_not_found", NOT_FOUND));
    }

    public record CreateEmailTemplateCommand(
            String name,
            String subject,
            String htmlTemplate,
            String textTemplate,
            List<TemplateVariable> variables,
            Boolean active
    ) {
    }
}
