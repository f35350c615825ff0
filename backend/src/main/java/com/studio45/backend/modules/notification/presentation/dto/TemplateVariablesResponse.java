package com.studio45.backend.modules.notification.presentation.dto;

import java.util.List;

import com.studio45.backend.modules.notification.domain.TemplateVariable;

public record TemplateVariablesResponse(List<TemplateVariable> variables) {
}
