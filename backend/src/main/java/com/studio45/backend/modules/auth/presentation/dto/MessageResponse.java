package com.studio45.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
