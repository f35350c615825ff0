package com.studio45.backend.modules.notification.domain;

/**
 * Documents one placeholder a template expects, e.g. {@code ResetURL}.
 */
public record TemplateVariable(String name, String description) {
}
