package com.studio45.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.auth.domain.AppUser;

public record UserProfileResponse(
        UUID id,
        String email,
        String name,
        String phone,
        String company,
        List<String> roles,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse of(AppUser user, List<String> roles) {
        return new UserProfileResponse(
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
