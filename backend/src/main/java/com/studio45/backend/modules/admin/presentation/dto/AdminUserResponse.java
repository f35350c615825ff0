package com.studio45.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.auth.domain.AppUser;

public record AdminUserResponse(
        UUID id,
        String email,
        String name,
        String phone,
        String company,
        List<String> roles,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AdminUserResponse of(AppUser user, List<String> roles) {
        return new AdminUserResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getPhone(),
                user.getCompany(),
                roles,
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
