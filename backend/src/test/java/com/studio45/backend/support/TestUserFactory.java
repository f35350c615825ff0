package com.studio45.backend.support;

import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.rbac.application.RoleAssignmentService;
import com.studio45.backend.modules.rbac.domain.SystemRoles;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final AppUserRepository appUserRepository;
    private final RoleAssignmentService roleAssignmentService;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            RoleAssignmentService roleAssignmentService,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.roleAssignmentService = roleAssignmentService;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureAdmin(String email, String rawPassword) {
        AppUser admin = ensureUser(email, rawPassword, "Admin User");
        roleAssignmentService.assignRole(admin.getId(), SystemRoles.USER, null);
        roleAssignmentService.assignRole(admin.getId(), SystemRoles.ADMIN, null);
        return admin;
    }

    public AppUser ensureMember(String email, String rawPassword, String name) {
        AppUser user = ensureUser(email, rawPassword, name);
        roleAssignmentService.assignRole(user.getId(), SystemRoles.USER, null);
        return user;
    }

    public AppUser ensureUser(String email, String rawPassword, String name) {
        AppUser user = appUserRepository.findByEmail(AppUser.normalizeEmail(email))
                .orElseGet(AppUser::new);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setName(name);
        return appUserRepository.saveAndFlush(user);
    }
}
