package com.studio45.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.notification.application.EmailTemplateService;
import com.studio45.backend.modules.notification.application.EmailTemplateService.CreateEmailTemplateCommand;
import com.studio45.backend.modules.notification.presentation.dto.CreateEmailTemplateRequest;
import com.studio45.backend.modules.notification.presentation.dto.EmailTemplateListResponse;
import com.studio45.backend.modules.notification.presentation.dto.EmailTemplateResponse;
import com.studio45.backend.modules.notification.presentation.dto.EmailTemplateSummaryResponse;
import com.studio45.backend.modules.notification.presentation.dto.PreviewEmailTemplateRequest;
import com.studio45.backend.modules.notification.presentation.dto.RenderedEmailResponse;
import com.studio45.backend.modules.notification.presentation.dto.TemplateVariablesResponse;
import com.studio45.backend.modules.notification.presentation.dto.TestEmailResponse;
import com.studio45.backend.modules.notification.presentation.dto.TestEmailTemplateRequest;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/email-templates")
@Tag(name = "Email templates", description = "Mustache email templates used by outgoing notifications")
public class EmailTemplateController {

    private final EmailTemplateService emailTemplateService;

    public EmailTemplateController(EmailTemplateService emailTemplateService) {
        this.emailTemplateService = emailTemplateService;
    }

    @GetMapping
    public ResponseEntity<EmailTemplateListResponse> listTemplates() {
        List<EmailTemplateSummaryResponse> templates = emailTemplateService.listTemplates();
        return ResponseEntity.ok(new EmailTemplateListResponse(templates, templates.size()));
    }

    @PostMapping
    @Operation(summary = "Create a template", description = "All parts are test-rendered before the template is stored.")
    public ResponseEntity<EmailTemplateResponse> createTemplate(@Valid @RequestBody CreateEmailTemplateRequest request) {
        EmailTemplateResponse created = emailTemplateService.createTemplate(new CreateEmailTemplateCommand(
                request.name(),
                request.subject(),
                request.htmlTemplate(),
                request.textTemplate(),
                request.variables(),
                request.active()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmailTemplateResponse> getTemplate(@PathVariable("id") UUID templateId) {
        return ResponseEntity.ok(emailTemplateService.getTemplate(templateId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<EmailTemplateResponse> updateTemplate(@PathVariable("id") UUID templateId, @RequestBody JsonNode body) {
        return ResponseEntity.ok(emailTemplateService.updateTemplate(templateId, EmailTemplateUpdateParser.parse(body)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable("id") UUID templateId) {
        emailTemplateService.deleteTemplate(templateId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/preview")
    public ResponseEntity<RenderedEmailResponse> previewTemplate(
            @PathVariable("id") UUID templateId,
            @Valid @RequestBody PreviewEmailTemplateRequest request
    ) {
        return ResponseEntity.ok(emailTemplateService.previewTemplate(templateId, request.variables()));
    }

    @PostMapping("/{id}/test")
    @Operation(summary = "Render the template and send it to the given address")
    public ResponseEntity<TestEmailResponse> sendTestEmail(
            @PathVariable("id") UUID templateId,
            @Valid @RequestBody TestEmailTemplateRequest request
    ) {
        RenderedEmailResponse preview = emailTemplateService.sendTestEmail(templateId, request.email(), request.variables());
        return ResponseEntity.ok(new TestEmailResponse("Test email sent", preview));
    }

    @GetMapping("/{id}/variables")
    public ResponseEntity<TemplateVariablesResponse> getTemplateVariables(@PathVariable("id") UUID templateId) {
        return ResponseEntity.ok(new TemplateVariablesResponse(emailTemplateService.getTemplateVariables(templateId)));
    }
}
