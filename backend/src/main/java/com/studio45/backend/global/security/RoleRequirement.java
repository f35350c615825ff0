package com.studio45.backend.global.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Route-level role requirement: any of a set, all of a set, or exactly one named role.
 */
public final class RoleRequirement {

    public enum Mode {
        ANY_OF,
        ALL_OF
    }

    private final Mode mode;
    private final List<String> roles;

    private RoleRequirement(Mode mode, List<String> roles) {
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("RoleRequirement needs at least one role");
        }
        this.mode = mode;
        this.roles = roles;
    }

    public static RoleRequirement anyOf(String... roles) {
        return new RoleRequirement(Mode.ANY_OF, normalize(roles));
    }

    public static RoleRequirement allOf(String... roles) {
        return new RoleRequirement(Mode.ALL_OF, normalize(roles));
    }

    public static RoleRequirement role(String role) {
        return allOf(role);
    }

    public boolean isSatisfiedBy(Collection<String> grantedRoles) {
        if (grantedRoles == null || grantedRoles.isEmpty()) {
            return false;
        }
        return switch (mode) {
            case ANY_OF -> roles.stream().anyMatch(grantedRoles::contains);
            case ALL_OF -> grantedRoles.containsAll(roles);
        };
    }

    public Mode mode() {
        return mode;
    }

    public List<String> roles() {
        return roles;
    }

    private static List<String> normalize(String... roles) {
        return Arrays.stream(roles)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .distinct()
                .toList();
    }

    @Override
    public String toString() {
        return mode + roles.toString();
    }
}
