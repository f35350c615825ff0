package com.studio45.backend.modules.notification.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.notification.domain.RenderedEmail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tries each {@link TemplateSource} in order. A missing template or a failing source falls through
 * to the next one, so a degraded template store never blocks the caller's flow.
 */
@Component
public class TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    private final List<TemplateSource> sources;

    public TemplateResolver(List<TemplateSource> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one template source is required");
        }
        this.sources = List.copyOf(sources);
    }

    public RenderedEmail resolve(String templateName, Map<String, String> variables) {
        for (int i = 0; i < sources.size(); i++) {
            TemplateSource source = sources.get(i);
            try {
                Optional<RenderedEmail> rendered = source.render(templateName, variables);
                if (rendered.isPresent()) {
                    if (i > 0) {
                        log.warn("Template {} served by fallback source {}", templateName, source.sourceName());
                    }
                    return rendered.get();
                }
                log.warn("Template {} not found in {}", templateName, source.sourceName());
            } catch (RuntimeException e) {
                log.warn("Template {} failed to render from {}: {}", templateName, source.sourceName(), e.getMessage());
            }
        }
        throw ProblemException.internal("notification.template_unavailable", "Email template unavailable", null);
    }
}
