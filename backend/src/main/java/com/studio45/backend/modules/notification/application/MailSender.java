package com.studio45.backend.modules.notification.application;

import com.studio45.backend.modules.notification.domain.OutgoingEmail;

public interface MailSender {

    void send(OutgoingEmail email);
}
