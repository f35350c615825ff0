package com.studio45.backend.modules.notification.infrastructure.mail;

import com.studio45.backend.modules.notification.application.MailSender;
import com.studio45.backend.modules.notification.domain.OutgoingEmail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes outgoing mail to the application log instead of delivering it.
 */
@Component
public class LoggingMailSender implements MailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingMailSender.class);

    @Override
    public void send(OutgoingEmail email) {
        log.info("""

                ========================================
                From: {}
                To: {}
                Subject: {}

                {}
                ========================================""",
                email.from(),
                email.to(),
                email.content().subject(),
                email.content().textContent());
    }
}
