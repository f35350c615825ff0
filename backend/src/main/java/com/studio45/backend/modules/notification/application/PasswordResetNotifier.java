package com.studio45.backend.modules.notification.application;

import java.time.Duration;
import java.util.Map;

import com.studio45.backend.modules.notification.domain.OutgoingEmail;
import com.studio45.backend.modules.notification.domain.RenderedEmail;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class PasswordResetNotifier {

    public static final String TEMPLATE_NAME = "password_reset";
    public static final String RESET_URL_VARIABLE = "ResetURL";
    public static final String COMPANY_NAME_VARIABLE = "CompanyName";
    public static final String EXPIRY_MINUTES_VARIABLE = "ExpiryMinutes";

    private final TemplateResolver templateResolver;
    private final MailSender mailSender;
    private final String frontendUrl;
    private final String companyName;
    private final String fromAddress;
    private final String expiryMinutes;

    public PasswordResetNotifier(
            TemplateResolver templateResolver,
            MailSender mailSender,
            @Value("${app.frontend-url:http://localhost:5173}") String frontendUrl,
            @Value("${app.mail.company-name:Studio45}") String companyName,
            @Value("${app.mail.from:no-reply@studio45.local}") String fromAddress,
            @Value("${app.password-reset.ttl:15m}") Duration resetTokenTtl
    ) {
        this.templateResolver = templateResolver;
        this.mailSender = mailSender;
        this.frontendUrl = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
        this.companyName = companyName;
        this.fromAddress = fromAddress;
        this.expiryMinutes = Long.toString(resetTokenTtl.toMinutes());
    }

    public void sendPasswordReset(String email, String rawToken) {
        Map<String, String> variables = Map.of(
                RESET_URL_VARIABLE, buildResetUrl(rawToken),
                COMPANY_NAME_VARIABLE, companyName,
                EXPIRY_MINUTES_VARIABLE, expiryMinutes
        );
        RenderedEmail rendered = templateResolver.resolve(TEMPLATE_NAME, variables);
        mailSender.send(new OutgoingEmail(fromAddress, email, rendered));
    }

    String buildResetUrl(String rawToken) {
        return frontendUrl + "/reset-password?token=" + rawToken;
    }
}
