package com.studio45.backend.modules.admin.application;

import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.rbac.application.RoleAssignmentService;
import com.studio45.backend.modules.rbac.domain.SystemRoles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Promotes the account named by {@code app.bootstrap.admin-email} to admin once the application is up.
 * Safe to run on every start.
 */
@Component
public class AdminBootstrapRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapRunner.class);

    private final AppUserRepository appUserRepository;
    private final RoleAssignmentService roleAssignmentService;
    private final String adminEmail;

    public AdminBootstrapRunner(
            AppUserRepository appUserRepository,
            RoleAssignmentService roleAssignmentService,
            @Value("${app.bootstrap.admin-email:}") String adminEmail
    ) {
        this.appUserRepository = appUserRepository;
        this.roleAssignmentService = roleAssignmentService;
        this.adminEmail = adminEmail;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void promoteConfiguredAdmin() {
        if (adminEmail == null || adminEmail.isBlank()) {
            return;
        }
        String email = AppUser.normalizeEmail(adminEmail);
        appUserRepository.findByEmail(email).ifPresentOrElse(
                user -> {
                    boolean granted = roleAssignmentService.assignRole(user.getId(), SystemRoles.ADMIN, null);
                    if (granted) {
                        log.info("Granted admin role to bootstrap user {}", user.getId());
                    } else {
                        log.info("Bootstrap user {} already has the admin role", user.getId());
                    }
                },
                () -> log.warn("Bootstrap admin {} does not exist yet; skipping promotion", email)
        );
    }
}
