package com.studio45.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.admin.presentation.dto.AdminUserResponse;
import com.studio45.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.studio45.backend.modules.admin.presentation.dto.PermissionCheckResponse;
import com.studio45.backend.modules.admin.presentation.dto.UserPermissionsResponse;
import com.studio45.backend.modules.auth.application.PhoneNumberPolicy;
import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.domain.UserFieldUpdate;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.studio45.backend.modules.rbac.application.AuthorizationResolver;
import com.studio45.backend.modules.rbac.application.GuardPolicy;
import com.studio45.backend.modules.rbac.application.RoleAssignmentService;
import com.studio45.backend.modules.rbac.domain.SystemRoles;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;
    private static final String DEFAULT_SORT_PROPERTY = "createdAt";
    private static final Map<String, String> SORT_PROPERTIES = Map.of(
            "email", "email",
            "name", "name",
            "created_at", "createdAt",
            "updated_at", "updatedAt"
    );

    private final AppUserRepository appUserRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final RoleAssignmentService roleAssignmentService;
    private final AuthorizationResolver authorizationResolver;
    private final GuardPolicy guardPolicy;
    private final PhoneNumberPolicy phoneNumberPolicy;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserAdministrationService(
            AppUserRepository appUserRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            RoleAssignmentService roleAssignmentService,
            AuthorizationResolver authorizationResolver,
            GuardPolicy guardPolicy,
            PhoneNumberPolicy phoneNumberPolicy,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.roleAssignmentService = roleAssignmentService;
        this.authorizationResolver = authorizationResolver;
        this.guardPolicy = guardPolicy;
        this.phoneNumberPolicy = phoneNumberPolicy;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public AdminUsersResponse listUsers(@NonNull UserListQuery query) {
        int page = Math.max(1, query.page() == null ? 1 : query.page());
        int limit = query.limit() == null ? DEFAULT_LIMIT : Math.min(MAX_LIMIT, Math.max(1, query.limit()));
        String property = SORT_PROPERTIES.getOrDefault(
                query.sortBy() == null ? "" : query.sortBy().toLowerCase(Locale.ROOT),
                DEFAULT_SORT_PROPERTY
        );
        Sort sort = Sort.by(query.sortDesc() ? Sort.Direction.DESC : Sort.Direction.ASC, property);

        String search = query.search() == null ? "" : query.search().trim().toLowerCase(Locale.ROOT);
        Page<AppUser> result = appUserRepository.searchByPattern("%" + search + "%", PageRequest.of(page - 1, limit, sort));

        List<AdminUserResponse> users = result.getContent().stream()
                .map(user -> AdminUserResponse.of(user, authorizationResolver.getRoleNames(user.getId())))
                .toList();
        return new AdminUsersResponse(users, result.getTotalElements(), page, limit, result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public AdminUserResponse getUser(@NonNull UUID userId) {
        return toResponse(findUser(userId));
    }

    /**
     * Creates an account on behalf of an administrator. Roles default to {@code user}; an unknown role name
     * aborts the whole creation.
     */
    public AdminUserResponse createUser(@NonNull UUID actorId, @NonNull CreateUserCommand command) {
        String email = AppUser.normalizeEmail(command.email());
        if (appUserRepository.existsByEmailIncludingDeleted(email)) {
            throw ProblemException.conflict("auth.email_exists", "Email already exists");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(command.password()));
        user.setName(command.name().trim());
        if (command.phone() != null && !command.phone().isBlank()) {
            user.setPhone(phoneNumberPolicy.normalize(command.phone()));
        }
        if (command.company() != null && !command.company().isBlank()) {
            user.setCompany(command.company().trim());
        }
        AppUser saved = appUserRepository.saveAndFlush(user);

        List<String> roles = command.roles() == null || command.roles().isEmpty()
                ? List.of(SystemRoles.USER)
                : command.roles();
        roleAssignmentService.setRolesForUser(saved.getId(), roles, actorId);

        log.info("User {} created by {}", saved.getId(), actorId);
        return toResponse(saved);
    }

    public AdminUserResponse updateUser(@NonNull UUID userId, @NonNull List<UserFieldUpdate> updates) {
        if (updates.isEmpty()) {
            throw ProblemException.validation("admin.no_fields", "No fields to update");
        }
        AppUser user = findUser(userId);
        for (UserFieldUpdate update : updates) {
            if (update instanceof UserFieldUpdate.EmailUpdate emailUpdate
                    && appUserRepository.existsByEmailForOtherUser(emailUpdate.email(), userId)) {
                throw ProblemException.conflict("auth.email_exists", "Email already exists");
            }
        }
        updates.forEach(update -> update.applyTo(user));
        AppUser saved = appUserRepository.saveAndFlush(user);
        log.info("User {} updated", userId);
        return toResponse(saved);
    }

    public AdminUserResponse setUserRoles(@NonNull UUID actorId, @NonNull UUID userId, @NonNull List<String> roles) {
        AppUser user = findUser(userId);
        guardPolicy.checkRoleReplacement(actorId, userId, roles);
        roleAssignmentService.setRolesForUser(userId, roles, actorId);
        return toResponse(user);
    }

    /**
     * Soft-deletes the account and drops its grants and pending reset tokens in the same transaction.
     */
    public void deleteUser(@NonNull UUID actorId, @NonNull UUID userId) {
        guardPolicy.checkUserDeletion(actorId, userId);
        AppUser user = findUser(userId);
        user.markDeleted(OffsetDateTime.now(clock));
        appUserRepository.saveAndFlush(user);

        roleAssignmentService.revokeAll(userId);
        passwordResetTokenRepository.deleteAllForUser(userId);
        log.info("User {} deleted by {}", userId, actorId);
    }

    @Transactional(readOnly = true)
    public UserPermissionsResponse getUserPermissions(@NonNull UUID userId) {
        findUser(userId);
        List<PermissionResponse> permissions = authorizationResolver.getPermissions(userId).stream()
                .map(PermissionResponse::from)
                .toList();
        return new UserPermissionsResponse(userId, permissions);
    }

    @Transactional(readOnly = true)
    public PermissionCheckResponse checkUserPermission(@NonNull UUID userId, @NonNull String permission) {
        findUser(userId);
        return new PermissionCheckResponse(userId, permission, authorizationResolver.hasPermission(userId, permission));
    }

    private AdminUserResponse toResponse(AppUser user) {
        return AdminUserResponse.of(user, authorizationResolver.getRoleNames(user.getId()));
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .filter(user -> !user.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("admin.user_not_found", "User not found"));
    }

    public record UserListQuery(Integer page, Integer limit, String search, String sortBy, boolean sortDesc) {
    }

    public record CreateUserCommand(
            String email,
            String password,
            String name,
            String phone,
            String company,
            List<String> roles
    ) {
    }
}
