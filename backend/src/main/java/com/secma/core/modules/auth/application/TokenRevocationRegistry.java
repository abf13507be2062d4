package com.secma.core.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;

import com.secma.core.global.error.StoreFailures;
import com.secma.core.modules.auth.domain.RevokedToken;
import com.secma.core.modules.auth.infrastructure.persistence.RevokedTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Persistent set of revoked token ids. Entries live until the token they protect would have
 * expired anyway.
 */
@Component
public class TokenRevocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(TokenRevocationRegistry.class);

    private final RevokedTokenRepository revokedTokenRepository;
    private final Clock clock;

    public TokenRevocationRegistry(RevokedTokenRepository revokedTokenRepository, Clock clock) {
        this.revokedTokenRepository = revokedTokenRepository;
        this.clock = clock;
    }

    public boolean isRevoked(String jti) {
        try {
            return revokedTokenRepository.existsById(jti);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    /**
     * Records the revocation. Idempotent, and a no-op once the token has expired. Of several
     * concurrent calls for the same jti exactly one returns true: the others lose on the primary key.
     *
     * @return true when this call recorded the revocation, false when it was already revoked or expired
     */
    public boolean revoke(String jti, Instant expiresAt) {
        Instant now = clock.instant();
        if (!now.isBefore(expiresAt)) {
            return false;
        }
        try {
            if (revokedTokenRepository.existsById(jti)) {
                return false;
            }
            revokedTokenRepository.saveAndFlush(new RevokedToken(
                    jti,
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone()),
                    OffsetDateTime.ofInstant(now, clock.getZone())
            ));
            log.debug("Revoked token {} until {}", jti, expiresAt);
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Token {} was revoked concurrently", jti);
            return false;
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public int pruneExpired() {
        try {
            return revokedTokenRepository.deleteExpired(OffsetDateTime.now(clock));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }
}
