package com.studio45.backend.modules.rbac.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.studio45.backend.modules.rbac.domain.UserRole;
import com.studio45.backend.modules.rbac.domain.UserRoleId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, UserRoleId> {

    @Query("""
            select r.name from UserRole ur
            join ur.role r
            where ur.id.userId = :userId
              and (ur.expiresAt is null or ur.expiresAt > :now)
            order by r.name
            """)
    List<String> findActiveRoleNames(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("select ur from UserRole ur join fetch ur.role where ur.id.userId = :userId")
    List<UserRole> findAllForUser(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserRole ur where ur.id.userId = :userId")
    int deleteAllForUser(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserRole ur where ur.id.roleId = :roleId")
    int deleteAllForRole(@Param("roleId") UUID roleId);
}
