package com.studio45.backend.modules.notification.domain;

public record OutgoingEmail(String from, String to, RenderedEmail content) {
}
