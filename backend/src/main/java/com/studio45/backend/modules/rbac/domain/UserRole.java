package com.studio45.backend.modules.rbac.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * One role held by one user. (user, role) is the identity, so a role cannot be held twice.
 */
@Entity
@Table(name = "user_roles")
public class UserRole implements Persistable<UserRoleId> {

    @EmbeddedId
    private UserRoleId id;

    @MapsId("roleId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id")
    private Role role;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;

    @Column(name = "granted_by", columnDefinition = "uuid")
    private UUID grantedBy;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    // assigned composite id; tells Spring Data to persist instead of merge
    @Transient
    private boolean newGrant = true;

    protected UserRole() {
    }

    public UserRole(UUID userId, Role role, OffsetDateTime grantedAt, UUID grantedBy) {
        this.id = new UserRoleId(userId, role.getId());
        this.role = role;
        this.grantedAt = grantedAt;
        this.grantedBy = grantedBy;
    }

    @Override
    public UserRoleId getId() {
        return id;
    }

    @Override
    public boolean isNew() {
        return newGrant;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newGrant = false;
    }

    public UUID getUserId() {
        return id.getUserId();
    }

    public Role getRole() {
        return role;
    }

    public OffsetDateTime getGrantedAt() {
        return grantedAt;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    /**
     * Grants without an expiry never lapse; expired grants are ignored by role and permission resolution.
     */
    public boolean isActiveAt(OffsetDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
