package com.studio45.backend.modules.rbac.domain;

import java.util.Set;

/**
 * Reserved role and permission names the guard rules depend on.
 */
public final class SystemRoles {

    public static final String ADMIN = "admin";
    public static final String USER = "user";
    /** Seeded but editable; grants read access to operational endpoints. */
    public static final String MODERATOR = "moderator";

    /** Admin panel access; can never be removed from {@link #ADMIN}. */
    public static final String ADMIN_ACCESS = "admin.access";

    public static final Set<String> PROTECTED = Set.of(ADMIN, USER);

    private SystemRoles() {
    }

    public static boolean isSystemRole(String roleName) {
        return roleName != null && PROTECTED.contains(roleName);
    }
}
