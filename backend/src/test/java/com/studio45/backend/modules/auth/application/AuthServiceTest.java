package com.studio45.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.studio45.backend.global.error.ErrorKind;
import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.domain.UserFieldUpdate;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.auth.presentation.dto.AuthResponse;
import com.studio45.backend.modules.auth.presentation.dto.LoginRequest;
import com.studio45.backend.modules.auth.presentation.dto.RegisterRequest;
import com.studio45.backend.modules.rbac.application.AuthorizationResolver;
import com.studio45.backend.modules.rbac.application.RoleAssignmentService;
import com.studio45.backend.modules.rbac.domain.SystemRoles;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private RoleAssignmentService roleAssignmentService;

    @Mock
    private AuthorizationResolver authorizationResolver;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtTokenService jwtTokenService;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(
                appUserRepository,
                roleAssignmentService,
                authorizationResolver,
                new PhoneNumberPolicy("ID"),
                passwordEncoder,
                jwtTokenService
        );
    }

    @Test
    void registerNormalizesInputAndGrantsDefaultRole() {
        UUID userId = UUID.randomUUID();
        when(appUserRepository.existsByEmailIncludingDeleted("alice@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret1")).thenReturn("hashed");
        when(appUserRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> {
            AppUser user = invocation.getArgument(0);
            ReflectionTestUtils.setField(user, "id", userId);
            return user;
        });
        when(jwtTokenService.issue(userId, "alice@example.com"))
                .thenReturn(new IssuedToken("token", Instant.parse("2024-05-02T10:00:00Z")));
        when(authorizationResolver.getRoleNames(userId)).thenReturn(List.of(SystemRoles.USER));

        AuthResponse response = authService.register(
                new RegisterRequest(" Alice@Example.com ", "secret1", " Alice ", "0821-1234-5678"));

        verify(roleAssignmentService).assignRole(userId, SystemRoles.USER, null);
        assertThat(response.token()).isEqualTo("token");
        assertThat(response.user().email()).isEqualTo("alice@example.com");
        assertThat(response.user().name()).isEqualTo("Alice");
        assertThat(response.user().roles()).containsExactly(SystemRoles.USER);
    }

    @Test
    void registerRejectsTakenEmail() {
        when(appUserRepository.existsByEmailIncludingDeleted("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("alice@example.com", "secret1", "Alice", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.CONFLICT));
        verify(appUserRepository, never()).saveAndFlush(any());
    }

    @Test
    void registerFailsWhenDefaultRoleCannotBeGranted() {
        UUID userId = UUID.randomUUID();
        when(appUserRepository.existsByEmailIncludingDeleted("alice@example.com")).thenReturn(false);
        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        when(appUserRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> {
            AppUser user = invocation.getArgument(0);
            ReflectionTestUtils.setField(user, "id", userId);
            return user;
        });
        doThrow(ProblemException.validation("rbac.role_not_found", "Role not found: user"))
                .when(roleAssignmentService).assignRole(eq(userId), eq(SystemRoles.USER), isNull());

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("alice@example.com", "secret1", "Alice", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INTERNAL);
                    assertThat(ex.getReason()).isEqualTo("Failed to assign default role");
                });
    }

    @Test
    void loginRejectsWrongPasswordAndUnknownEmailAlike() {
        AppUser user = new AppUser();
        user.setEmail("alice@example.com");
        user.setPasswordHash("hashed");
        when(appUserRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);
        when(appUserRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest("alice@example.com", "wrong")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.UNAUTHORIZED);
                    assertThat(ex.getReason()).isEqualTo("Invalid email or password");
                });
        assertThatThrownBy(() -> authService.login(new LoginRequest("ghost@example.com", "wrong")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo("Invalid email or password"));
    }

    @Test
    void profileUpdateCannotChangeEmail() {
        UUID userId = UUID.randomUUID();
        AppUser user = new AppUser();
        user.setEmail("alice@example.com");
        when(appUserRepository.findById(userId)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.updateProfile(userId,
                List.of(new UserFieldUpdate.EmailUpdate("other@example.com"))))
                .isInstanceOf(ProblemException.class);
        assertThat(user.getEmail()).isEqualTo("alice@example.com");
    }
}
