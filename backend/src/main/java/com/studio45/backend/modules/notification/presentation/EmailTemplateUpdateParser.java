package com.studio45.backend.modules.notification.presentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.global.web.PartialUpdateFields;
import com.studio45.backend.modules.notification.domain.EmailTemplateUpdate;
import com.studio45.backend.modules.notification.domain.TemplateVariable;

import com.fasterxml.jackson.databind.JsonNode;

final class EmailTemplateUpdateParser {

    private static final Set<String> FIELDS = Set.of("name", "subject", "htmlTemplate", "textTemplate", "variables", "active");
    private static final Set<String> READ_ONLY_FIELDS = Set.of("id", "createdAt", "updatedAt");

    private EmailTemplateUpdateParser() {
    }

    static List<EmailTemplateUpdate> parse(JsonNode body) {
        PartialUpdateFields fields = PartialUpdateFields.of(body);
        fields.rejectUnknown(FIELDS, READ_ONLY_FIELDS);

        List<EmailTemplateUpdate> updates = new ArrayList<>();
        if (fields.has("name")) {
            updates.add(new EmailTemplateUpdate.NameUpdate(fields.requiredText("name", 1, 100)));
        }
        if (fields.has("subject")) {
            updates.add(new EmailTemplateUpdate.SubjectUpdate(fields.requiredText("subject", 1, 500)));
        }
        if (fields.has("htmlTemplate")) {
            updates.add(new EmailTemplateUpdate.HtmlTemplateUpdate(fields.requiredText("htmlTemplate", 1, Integer.MAX_VALUE)));
        }
        if (fields.has("textTemplate")) {
            updates.add(new EmailTemplateUpdate.TextTemplateUpdate(fields.requiredText("textTemplate", 1, Integer.MAX_VALUE)));
        }
        if (fields.has("variables")) {
            updates.add(new EmailTemplateUpdate.VariablesUpdate(parseVariables(fields.raw("variables"))));
        }
        fields.optionalBoolean("active").ifPresent(active -> updates.add(new EmailTemplateUpdate.ActiveUpdate(active)));
        return updates;
    }

    private static List<TemplateVariable> parseVariables(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw ProblemException.validation("validation_error", "variables: must be an array");
        }
        List<TemplateVariable> variables = new ArrayList<>();
        for (JsonNode element : node) {
            JsonNode name = element.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                throw ProblemException.validation("validation_error", "variables: every entry needs a name");
            }
            JsonNode description = element.get("description");
            variables.add(new TemplateVariable(
                    name.asText().trim(),
                    description == null || description.isNull() ? "" : description.asText()
            ));
        }
        return variables;
    }
}
