package com.studio45.backend.modules.notification.infrastructure.template;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.studio45.backend.modules.notification.application.PasswordResetNotifier;
import com.studio45.backend.modules.notification.application.TemplateSource;
import com.studio45.backend.modules.notification.domain.RenderedEmail;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Hardcoded last-resort templates. Does not touch the database or the template engine.
 */
@Component
@Order(100)
public class BuiltInTemplateSource implements TemplateSource {

    static final String PASSWORD_RESET_SUBJECT = "Reset Your Password";

    private final long expiryMinutes;

    public BuiltInTemplateSource(@Value("${app.password-reset.ttl:15m}") Duration resetTokenTtl) {
        this.expiryMinutes = resetTokenTtl.toMinutes();
    }

    @Override
    public String sourceName() {
        return "built-in";
    }

    @Override
    public Optional<RenderedEmail> render(String templateName, Map<String, String> variables) {
        if (!PasswordResetNotifier.TEMPLATE_NAME.equals(templateName)) {
            return Optional.empty();
        }
        String resetUrl = variables.getOrDefault(PasswordResetNotifier.RESET_URL_VARIABLE, "");
        String text = String.format(
                "Click the link below to reset your password:\n%s\n\nThis link expires in %d minutes.",
                resetUrl,
                expiryMinutes
        );
        String escapedUrl = HtmlUtils.htmlEscape(resetUrl);
        String html = "<p>Click the link below to reset your password:</p>"
                + "<p><a href=\"" + escapedUrl + "\">" + escapedUrl + "</a></p>"
                + "<p>This link expires in " + expiryMinutes + " minutes.</p>";
        return Optional.of(new RenderedEmail(PASSWORD_RESET_SUBJECT, html, text));
    }
}
