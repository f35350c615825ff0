package com.studio45.backend.global.security;

import java.util.function.Supplier;

import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * Evaluates a {@link RoleRequirement} against the roles resolved by {@link JwtAuthenticationFilter}.
 */
public class RoleRequirementAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final RoleRequirement requirement;

    public RoleRequirementAuthorizationManager(RoleRequirement requirement) {
        this.requirement = requirement;
    }

    public static RoleRequirementAuthorizationManager of(RoleRequirement requirement) {
        return new RoleRequirementAuthorizationManager(requirement);
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        Authentication current = authentication.get();
        if (current == null || !(current.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return new AuthorizationDecision(false);
        }
        return new AuthorizationDecision(requirement.isSatisfiedBy(principal.roles()));
    }
}
