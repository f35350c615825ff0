package com.studio45.backend.modules.auth.presentation;

import com.studio45.backend.modules.auth.application.AuthService;
import com.studio45.backend.modules.auth.application.PasswordResetService;
import com.studio45.backend.modules.auth.presentation.dto.AuthResponse;
import com.studio45.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.studio45.backend.modules.auth.presentation.dto.LoginRequest;
import com.studio45.backend.modules.auth.presentation.dto.MessageResponse;
import com.studio45.backend.modules.auth.presentation.dto.RegisterRequest;
import com.studio45.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Auth", description = "Registration, login and password recovery")
public class AuthController {

    private final AuthService authService;
    private final PasswordResetService passwordResetService;

    public AuthController(AuthService authService, PasswordResetService passwordResetService) {
        this.authService = authService;
        this.passwordResetService = passwordResetService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a new account", description = "The account receives the default user role.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email already exists")
    })
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/forgot-password")
    @Operation(summary = "Request a password reset link")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(new MessageResponse(passwordResetService.forgotPassword(request.email())));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Reset the password with an emailed token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password replaced"),
            @ApiResponse(responseCode = "401", description = "Invalid or expired reset token")
    })
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(new MessageResponse(passwordResetService.resetPassword(request.token(), request.password())));
    }
}
