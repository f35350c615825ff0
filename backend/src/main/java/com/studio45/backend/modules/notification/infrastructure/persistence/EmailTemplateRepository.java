package com.studio45.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.studio45.backend.modules.notification.domain.EmailTemplate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

    List<EmailTemplate> findAllByOrderByNameAsc();

    Optional<EmailTemplate> findByNameAndActiveTrue(String name);

    /**
     * The unique index covers soft-deleted rows too, so name checks look at the raw table.
     */
    @Query(value = "select exists(select 1 from email_templates where name = :name)", nativeQuery = true)
    boolean existsByNameIncludingDeleted(@Param("name") String name);

    @Query(value = "select exists(select 1 from email_templates where name = :name and id <> :excludedId)", nativeQuery = true)
    boolean existsByNameForOtherTemplate(@Param("name") String name, @Param("excludedId") UUID excludedId);
}
