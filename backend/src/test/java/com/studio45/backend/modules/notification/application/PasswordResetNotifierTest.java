package com.studio45.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;

import com.studio45.backend.modules.notification.domain.OutgoingEmail;
import com.studio45.backend.modules.notification.domain.RenderedEmail;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PasswordResetNotifierTest {

    @Mock
    private TemplateResolver templateResolver;

    @Mock
    private MailSender mailSender;

    @Test
    void rendersResetTemplateWithLinkCompanyNameAndExpiry() {
        PasswordResetNotifier notifier = new PasswordResetNotifier(templateResolver, mailSender,
                "https://app.studio45.test/", "Studio45", "no-reply@studio45.test", Duration.ofMinutes(30));
        Map<String, String> expectedVariables = Map.of(
                "ResetURL", "https://app.studio45.test/reset-password?token=abc123",
                "CompanyName", "Studio45",
                "ExpiryMinutes", "30"
        );
        RenderedEmail rendered = new RenderedEmail("Reset", "<p>html</p>", "text");
        when(templateResolver.resolve(eq("password_reset"), eq(expectedVariables))).thenReturn(rendered);

        notifier.sendPasswordReset("alice@example.com", "abc123");

        ArgumentCaptor<OutgoingEmail> captor = ArgumentCaptor.forClass(OutgoingEmail.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().to()).isEqualTo("alice@example.com");
        assertThat(captor.getValue().from()).isEqualTo("no-reply@studio45.test");
        assertThat(captor.getValue().content()).isEqualTo(rendered);
    }
}
