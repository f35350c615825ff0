package com.studio45.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.rbac.domain.Role;
import com.studio45.backend.modules.rbac.domain.UserRole;
import com.studio45.backend.modules.rbac.domain.UserRoleId;
import com.studio45.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.studio45.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes role grants. Replacement is all-or-nothing: every name is resolved before any row changes,
 * and the delete and insert share one transaction.
 */
@Service
@Transactional
public class RoleAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RoleAssignmentService.class);

    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final Clock clock;

    public RoleAssignmentService(
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.clock = clock;
    }

    /**
     * Replaces every grant the user holds. An empty list leaves the user with no roles.
     *
     * @param grantedBy acting user recorded on each new grant, may be {@code null} for system grants
     */
    public void setRolesForUser(@NonNull UUID userId, @NonNull Collection<String> roleNames, UUID grantedBy) {
        Set<String> requested = roleNames.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<String, Role> rolesByName = roleRepository.findByNameIn(requested).stream()
                .collect(Collectors.toMap(Role::getName, Function.identity()));
        for (String name : requested) {
            if (!rolesByName.containsKey(name)) {
                throw ProblemException.validation("rbac.role_not_found", "role not found: " + name);
            }
        }

        userRoleRepository.deleteAllForUser(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UserRole> grants = requested.stream()
                .map(name -> new UserRole(userId, rolesByName.get(name), now, grantedBy))
                .toList();
        userRoleRepository.saveAll(grants);

        log.info("Roles for user {} set to {} by {}", userId, requested, grantedBy);
    }

    /**
     * Adds a single grant, leaving existing ones alone. Returns {@code false} when the user already held it.
     */
    public boolean assignRole(@NonNull UUID userId, @NonNull String roleName, UUID grantedBy) {
        Role role = roleRepository.findByName(roleName)
                .orElseThrow(() -> ProblemException.validation("rbac.role_not_found", "role not found: " + roleName));
        if (userRoleRepository.existsById(new UserRoleId(userId, role.getId()))) {
            return false;
        }
        userRoleRepository.save(new UserRole(userId, role, OffsetDateTime.now(clock), grantedBy));
        return true;
    }

    public void revokeAll(@NonNull UUID userId) {
        int removed = userRoleRepository.deleteAllForUser(userId);
        log.info("Revoked {} grant(s) from user {}", removed, userId);
    }
}
