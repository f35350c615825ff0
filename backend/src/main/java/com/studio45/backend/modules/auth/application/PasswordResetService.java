package com.studio45.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.auth.domain.AppUser;
import com.studio45.backend.modules.auth.domain.PasswordResetToken;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.studio45.backend.modules.notification.application.PasswordResetNotifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Forgot/reset password flow. A new request invalidates every earlier token of the same user,
 * so at most one token per user is ever live.
 */
@Service
@Transactional
public class PasswordResetService {

    public static final String FORGOT_PASSWORD_MESSAGE =
            "If an account with that email exists, a password reset link has been sent.";
    public static final String RESET_SUCCESS_MESSAGE = "Password has been reset successfully.";

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);
    private static final String INVALID_TOKEN = "Invalid or expired reset token";

    private final AppUserRepository appUserRepository;
    private final PasswordResetTokenRepository tokenRepository;
    private final PasswordResetNotifier notifier;
    private final PasswordEncoder passwordEncoder;
    private final Duration tokenTtl;
    private final Clock clock;

    public PasswordResetService(
            AppUserRepository appUserRepository,
            PasswordResetTokenRepository tokenRepository,
            PasswordResetNotifier notifier,
            PasswordEncoder passwordEncoder,
            @Value("${app.password-reset.ttl:15m}") Duration tokenTtl,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.tokenRepository = tokenRepository;
        this.notifier = notifier;
        this.passwordEncoder = passwordEncoder;
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    /**
     * Always answers the same way so the response does not reveal whether the account exists.
     */
    public String forgotPassword(@NonNull String email) {
        Optional<AppUser> user = appUserRepository.findByEmail(AppUser.normalizeEmail(email));
        if (user.isEmpty()) {
            log.debug("Password reset requested for unknown email");
            return FORGOT_PASSWORD_MESSAGE;
        }

        AppUser account = user.get();
        tokenRepository.deleteAllForUser(account.getId());

        String rawToken = TokenHasher.generateToken();
        OffsetDateTime now = OffsetDateTime.now(clock);
        tokenRepository.save(new PasswordResetToken(
                account.getId(),
                TokenHasher.sha256Hex(rawToken),
                now,
                now.plus(tokenTtl)
        ));

        try {
            notifier.sendPasswordReset(account.getEmail(), rawToken);
        } catch (RuntimeException e) {
            throw ProblemException.internal("auth.reset_email_failed", "Failed to send reset email", e);
        }
        log.info("Password reset token issued for user {}", account.getId());
        return FORGOT_PASSWORD_MESSAGE;
    }

    /**
     * An expired token is removed even though the call fails, so the transaction commits on rejection.
     */
    @Transactional(noRollbackFor = ProblemException.class)
    public String resetPassword(@NonNull String rawToken, @NonNull String newPassword) {
        PasswordResetToken token = tokenRepository.findByTokenHash(TokenHasher.sha256Hex(rawToken))
                .orElseThrow(() -> ProblemException.unauthorized("auth.invalid_reset_token", INVALID_TOKEN));

        if (token.isExpired(OffsetDateTime.now(clock))) {
            tokenRepository.delete(token);
            throw ProblemException.unauthorized("auth.invalid_reset_token", INVALID_TOKEN);
        }

        AppUser user = appUserRepository.findById(token.getUserId())
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> ProblemException.unauthorized("auth.invalid_reset_token", INVALID_TOKEN));
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        appUserRepository.save(user);

        tokenRepository.deleteAllForUser(user.getId());
        log.info("Password reset completed for user {}", user.getId());
        return RESET_SUCCESS_MESSAGE;
    }
}
