package com.studio45.backend.modules.admin.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotBlank(message = "password is required") @Size(min = 6, message = "password must be at least 6 characters") String password,
        @NotBlank(message = "name is required") @Size(min = 2, max = 255) String name,
        String phone,
        @Size(max = 255) String company,
        List<String> roles
) {
}
