package com.studio45.backend.modules.notification.domain;

import java.util.List;
import java.util.Objects;

public sealed interface EmailTemplateUpdate {

    void applyTo(EmailTemplate template);

    record NameUpdate(String name) implements EmailTemplateUpdate {
        public NameUpdate {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void applyTo(EmailTemplate template) {
            template.setName(name);
        }
    }

    record SubjectUpdate(String subject) implements EmailTemplateUpdate {
        public SubjectUpdate {
            Objects.requireNonNull(subject, "subject");
        }

        @Override
        public void applyTo(EmailTemplate template) {
            template.setSubject(subject);
        }
    }

    record HtmlTemplateUpdate(String htmlTemplate) implements EmailTemplateUpdate {
        public HtmlTemplateUpdate {
            Objects.requireNonNull(htmlTemplate, "htmlTemplate");
        }

        @Override
        public void applyTo(EmailTemplate template) {
            template.setHtmlTemplate(htmlTemplate);
        }
    }

    record TextTemplateUpdate(String textTemplate) implements EmailTemplateUpdate {
        public TextTemplateUpdate {
            Objects.requireNonNull(textTemplate, "textTemplate");
        }

        @Override
        public void applyTo(EmailTemplate template) {
            template.setTextTemplate(textTemplate);
        }
    }

    record VariablesUpdate(List<TemplateVariable> variables) implements EmailTemplateUpdate {
        public VariablesUpdate {
            variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
        }

        @Override
        public void applyTo(EmailTemplate template) {
            template.setVariables(variables);
        }
    }

    record ActiveUpdate(boolean active) implements EmailTemplateUpdate {
        @Override
        public void applyTo(EmailTemplate template) {
            template.setActive(active);
        }
    }
}
