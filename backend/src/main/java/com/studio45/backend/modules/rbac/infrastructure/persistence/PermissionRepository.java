package com.studio45.backend.modules.rbac.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.studio45.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByName(String name);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);

    List<Permission> findAllByOrderByResourceAscActionAsc();

    /**
     * Union of permissions across the user's unexpired grants; a permission reachable through two roles appears once.
     */
    @Query("""
            select distinct p from UserRole ur
            join ur.role r
            join r.permissions p
            where ur.id.userId = :userId
              and (ur.expiresAt is null or ur.expiresAt > :now)
            order by p.name
            """)
    List<Permission> findEffectiveForUser(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("""
            select count(p) from UserRole ur
            join ur.role r
            join r.permissions p
            where ur.id.userId = :userId
              and p.name = :permissionName
              and (ur.expiresAt is null or ur.expiresAt > :now)
            """)
    long countEffectiveForUser(
            @Param("userId") UUID userId,
            @Param("permissionName") String permissionName,
            @Param("now") OffsetDateTime now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "delete from role_permissions where permission_id = :permissionId", nativeQuery = true)
    int deleteRoleLinks(@Param("permissionId") UUID permissionId);
}
