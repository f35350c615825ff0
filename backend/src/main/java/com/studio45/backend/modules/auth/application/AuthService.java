package com.studio45.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.domain.UserFieldUpdate;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.auth.presentation.dto.AuthResponse;
import com.studio45.backend.modules.auth.presentation.dto.LoginRequest;
import com.studio45.backend.modules.auth.presentation.dto.RegisterRequest;
import com.studio45.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.studio45.backend.modules.auth.presentation.dto.UserSummary;
import com.studio45.backend.modules.rbac.application.AuthorizationResolver;
import com.studio45.backend.modules.rbac.application.RoleAssignmentService;
import com.studio45.backend.modules.rbac.domain.SystemRoles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final AppUserRepository appUserRepository;
    private final RoleAssignmentService roleAssignmentService;
    private final AuthorizationResolver authorizationResolver;
    private final PhoneNumberPolicy phoneNumberPolicy;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            RoleAssignmentService roleAssignmentService,
            AuthorizationResolver authorizationResolver,
            PhoneNumberPolicy phoneNumberPolicy,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.roleAssignmentService = roleAssignmentService;
        this.authorizationResolver = authorizationResolver;
        this.phoneNumberPolicy = phoneNumberPolicy;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Creates the account and its default grant together; if the grant fails nothing is kept.
     */
    public AuthResponse register(@NonNull RegisterRequest request) {
        String email = AppUser.normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIncludingDeleted(email)) {
            throw ProblemException.conflict("auth.email_exists", "Email already exists");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setName(request.name().trim());
        if (request.phone() != null && !request.phone().isBlank()) {
            user.setPhone(phoneNumberPolicy.normalize(request.phone()));
        }
        AppUser saved = appUserRepository.saveAndFlush(user);

        try {
            roleAssignmentService.assignRole(saved.getId(), SystemRoles.USER, null);
        } catch (RuntimeException e) {
            throw ProblemException.internal("auth.default_role_failed", "Failed to assign default role", e);
        }

        log.info("User {} registered", saved.getId());
        return issueFor(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(@NonNull LoginRequest request) {
        AppUser user = appUserRepository.findByEmail(AppUser.normalizeEmail(request.email()))
                .orElse(null);
        if (user == null || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.info("Failed login attempt for {}", AppUser.normalizeEmail(request.email()));
            throw ProblemException.unauthorized("auth.invalid_credentials", INVALID_CREDENTIALS);
        }
        return issueFor(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(@NonNull UUID userId) {
        AppUser user = findUser(userId);
        return UserProfileResponse.of(user, authorizationResolver.getRoleNames(userId));
    }

    /**
     * Applies self-service changes. Email is not changeable here; the parser never yields an email update
     * for this path.
     */
    public UserProfileResponse updateProfile(@NonNull UUID userId, @NonNull List<UserFieldUpdate> updates) {
        AppUser user = findUser(userId);
        for (UserFieldUpdate update : updates) {
            if (update instanceof UserFieldUpdate.EmailUpdate) {
                throw ProblemException.validation("validation_error", "email cannot be changed from the profile");
            }
        }
        if (!updates.isEmpty()) {
            updates.forEach(update -> update.applyTo(user));
            appUserRepository.saveAndFlush(user);
        }
        return UserProfileResponse.of(user, authorizationResolver.getRoleNames(userId));
    }

    private AuthResponse issueFor(AppUser user) {
        IssuedToken token = jwtTokenService.issue(user.getId(), user.getEmail());
        List<String> roles = authorizationResolver.getRoleNames(user.getId());
        return new AuthResponse(
                token.token(),
                token.expiresAt(),
                new UserSummary(user.getId(), user.getEmail(), user.getName(), roles)
        );
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .filter(user -> !user.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("auth.user_not_found", "User not found"));
    }
}
