package com.secma.core.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * Revocation record keyed by the token's jti. Rows whose {@code expiresAt} has passed no longer
 * protect anything and are pruned.
 * <p>
 * The id is assigned, so the entity reports itself as new until it is persisted or loaded. Saving
 * then always issues an INSERT and a second revocation of the same jti hits the primary key.
 */
@Entity
@Table(name = "revoked_tokens")
public class RevokedToken implements Persistable<String> {

    @Id
    @Column(name = "jti", nullable = false, updatable = false, length = 64)
    private String jti;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked_at", nullable = false, updatable = false)
    private OffsetDateTime revokedAt;

    @Transient
    private boolean persisted;

    protected RevokedToken() {
    }

    public RevokedToken(String jti, OffsetDateTime expiresAt, OffsetDateTime revokedAt) {
        this.jti = jti;
        this.expiresAt = expiresAt;
        this.revokedAt = revokedAt;
    }

    @Override
    public String getId() {
        return jti;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        persisted = true;
    }

    public String getJti() {
        return jti;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }
}
