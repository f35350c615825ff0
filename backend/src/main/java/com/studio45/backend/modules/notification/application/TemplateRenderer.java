package com.studio45.backend.modules.notification.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.notification.domain.RenderedEmail;
import com.studio45.backend.modules.notification.domain.TemplateContent;
import com.studio45.backend.modules.notification.domain.TemplateVariable;

import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;

import org.springframework.stereotype.Component;

/**
 * Renders Mustache templates. HTML bodies escape variable values and drop unsafe URLs in URL attributes;
 * subject and text bodies are plain text and are rendered verbatim. A variable the caller did not supply
 * renders as an empty string. Partials are not supported.
 */
@Component
public class TemplateRenderer {

    static final String PLACEHOLDER_VALUE = "test_value";

    private static final Mustache.TemplateLoader NO_PARTIALS = name -> {
        throw new MustacheException("Partial templates are not supported: " + name);
    };

    private final Mustache.Compiler htmlCompiler = Mustache.compiler()
            .defaultValue("")
            .withLoader(NO_PARTIALS);
    private final Mustache.Compiler textCompiler = Mustache.compiler()
            .escapeHTML(false)
            .defaultValue("")
            .withLoader(NO_PARTIALS);

    public RenderedEmail render(TemplateContent content, Map<String, String> variables) {
        Map<String, String> context = variables == null ? Map.of() : variables;
        try {
            return new RenderedEmail(
                    textCompiler.compile(content.subject()).execute(context),
                    htmlCompiler.compile(content.htmlTemplate())
                            .execute(UrlAttributeSanitizer.sanitize(content.htmlTemplate(), context)),
                    textCompiler.compile(content.textTemplate()).execute(context)
            );
        } catch (MustacheException e) {
            throw ProblemException.validation("notification.template_invalid", "Failed to render template: " + e.getMessage());
        }
    }

    /**
     * Dry-runs every part with {@value #PLACEHOLDER_VALUE} for each declared variable.
     */
    public void validate(TemplateContent content, List<TemplateVariable> declared) {
        Map<String, String> placeholders = new LinkedHashMap<>();
        for (TemplateVariable variable : declared) {
            if (variable.name() != null && !variable.name().isBlank()) {
                placeholders.put(variable.name(), PLACEHOLDER_VALUE);
            }
        }
        render(content, placeholders);
    }
}
