package com.studio45.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.studio45.backend.modules.auth.domain.AppUser;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    /**
     * Checks the raw table so soft-deleted accounts still reserve their address.
     */
    @Query(value = "select exists(select 1 from users where email = :email)", nativeQuery = true)
    boolean existsByEmailIncludingDeleted(@Param("email") String email);

    @Query(value = "select exists(select 1 from users where email = :email and id <> :excludedId)", nativeQuery = true)
    boolean existsByEmailForOtherUser(@Param("email") String email, @Param("excludedId") UUID excludedId);

    @Query("select u from AppUser u where lower(u.email) like :pattern or lower(u.name) like :pattern")
    Page<AppUser> searchByPattern(@Param("pattern") String pattern, Pageable pageable);
}
