package com.studio45.backend.modules.notification.application;

import java.util.Map;
import java.util.Optional;

import com.studio45.backend.modules.notification.domain.RenderedEmail;

/**
 * A place templates can be rendered from. Returns empty when the source does not know the template.
 */
public interface TemplateSource {

    String sourceName();

    Optional<RenderedEmail> render(String templateName, Map<String, String> variables);
}
