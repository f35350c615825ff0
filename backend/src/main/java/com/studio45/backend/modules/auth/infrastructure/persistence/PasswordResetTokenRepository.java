package com.studio45.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.studio45.backend.modules.auth.domain.PasswordResetToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, UUID> {

    Optional<PasswordResetToken> findByTokenHash(String tokenHash);

    long countByUserId(UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from PasswordResetToken t where t.userId = :userId")
    int deleteAllForUser(@Param("userId") UUID userId);
}
