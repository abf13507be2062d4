package com.secma.core.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;

import com.secma.core.modules.auth.application.RevokedTokenPruneScheduler;
import com.secma.core.modules.auth.application.TokenRevocationRegistry;
import com.secma.core.modules.auth.domain.RevokedToken;
import com.secma.core.modules.auth.infrastructure.persistence.RevokedTokenRepository;
import com.secma.core.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class TokenRevocationRegistryIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    TokenRevocationRegistry revocationRegistry;

    @Autowired
    RevokedTokenRepository revokedTokenRepository;

    @Autowired
    Clock clock;

    @Test
    void revokeIsIdempotent() {
        Instant expiry = clock.instant().plus(Duration.ofMinutes(10));

        assertThat(revocationRegistry.revoke("jti-1", expiry)).isTrue();
        assertThat(revocationRegistry.revoke("jti-1", expiry)).isFalse();

        assertThat(revocationRegistry.isRevoked("jti-1")).isTrue();
        assertThat(revokedTokenRepository.count()).isEqualTo(1);
    }

    @Test
    void revokingExpiredTokenIsNoOp() {
        assertThat(revocationRegistry.revoke("jti-old", clock.instant().minusSeconds(1))).isFalse();

        assertThat(revocationRegistry.isRevoked("jti-old")).isFalse();
        assertThat(revokedTokenRepository.count()).isZero();
    }

    @Test
    void pruneRemovesOnlyExpiredEntries() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        revokedTokenRepository.save(new RevokedToken("expired", now.minusMinutes(1), now.minusHours(1)));
        revocationRegistry.revoke("live", clock.instant().plus(Duration.ofHours(1)));

        assertThat(revocationRegistry.pruneExpired()).isEqualTo(1);

        assertThat(revocationRegistry.isRevoked("expired")).isFalse();
        assertThat(revocationRegistry.isRevoked("live")).isTrue();
    }

    @Test
    void scheduledPruneUsesTheRegistry() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        revokedTokenRepository.save(new RevokedToken("expired", now.minusMinutes(1), now.minusHours(1)));

        new RevokedTokenPruneScheduler(revocationRegistry).pruneExpiredRevocations();

        assertThat(revokedTokenRepository.count()).isZero();
    }
}
