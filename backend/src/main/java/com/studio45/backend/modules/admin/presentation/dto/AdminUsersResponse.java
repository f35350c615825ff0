package com.studio45.backend.modules.admin.presentation.dto;

import java.util.List;

public record AdminUsersResponse(
        List<AdminUserResponse> users,
        long total,
        int page,
        int limit,
        int totalPages
) {
}
