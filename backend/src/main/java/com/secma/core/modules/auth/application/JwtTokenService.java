package com.secma.core.modules.auth.application;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.secma.core.global.config.SecmaProperties;
import com.secma.core.global.error.TokenInvalidException;
import com.secma.core.modules.auth.domain.TokenType;
import com.secma.core.modules.auth.infrastructure.jwt.JwtKeyRing;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.ProtectedHeader;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies HS256 JWTs. Each token names its signing key in the {@code kid} header, so
 * tokens signed before a key rotation verify until the retired key leaves its grace window.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_APPLICATION = "app";
    static final String CLAIM_TYPE = "type";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_SESSION = "sid";
    static final String CLAIM_SCOPES = "scopes";

    private final JwtKeyRing keyRing;
    private final TokenRevocationRegistry revocationRegistry;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final String issuer;
    private final Clock clock;

    public JwtTokenService(
            JwtKeyRing keyRing,
            TokenRevocationRegistry revocationRegistry,
            SecmaProperties properties,
            Clock clock
    ) {
        this.keyRing = keyRing;
        this.revocationRegistry = revocationRegistry;
        this.accessTokenTtl = properties.token().accessTtl();
        this.refreshTokenTtl = properties.token().refreshTtl();
        this.issuer = properties.token().issuer();
        this.clock = clock;
    }

    public String mintAccess(UUID userId, UUID applicationId, Collection<String> roles, Duration ttl) {
        return mintAccess(userId, applicationId, roles, ttl, null);
    }

    public String mintAccess(UUID userId, UUID applicationId, Collection<String> roles, Duration ttl, String sessionId) {
        List<String> roleNames = roles == null ? List.of() : List.copyOf(roles);
        return mint(TokenType.ACCESS, userId, applicationId, roleNames, List.of(), ttl, newJti(), sessionId);
    }

    public String mintRefresh(UUID userId, UUID applicationId, Duration ttl) {
        return mint(TokenType.REFRESH, userId, applicationId, null, List.of(), ttl, newJti(), null);
    }

    /**
     * Mints a refresh token and an access token bound to it through the {@code sid} claim, using
     * the configured lifetimes.
     */
    public TokenPair issueTokenPair(UUID userId, UUID applicationId, Collection<String> roles) {
        return issueTokenPair(userId, applicationId, roles, List.of());
    }

    /**
     * Same as {@link #issueTokenPair(UUID, UUID, Collection)}, with both tokens narrowed to
     * {@code scopes}. An empty collection leaves them unnarrowed.
     */
    public TokenPair issueTokenPair(UUID userId, UUID applicationId, Collection<String> roles, Collection<String> scopes) {
        Instant issuedAt = now();
        List<String> scopeList = scopes == null ? List.of() : List.copyOf(scopes);
        String refreshJti = newJti();
        String refreshToken = mint(TokenType.REFRESH, userId, applicationId, null, scopeList,
                refreshTokenTtl, refreshJti, null);
        String accessToken = mint(TokenType.ACCESS, userId, applicationId,
                roles == null ? List.of() : List.copyOf(roles), scopeList, accessTokenTtl, newJti(), refreshJti);
        return new TokenPair(
                accessToken,
                TokenPair.DEFAULT_TOKEN_TYPE,
                accessTokenTtl.toSeconds(),
                refreshToken,
                refreshTokenTtl.toSeconds(),
                issuedAt
        );
    }

    /**
     * Verifies signature, issuer, expiry, type and revocation. Expiry is inclusive: a token whose
     * {@code exp} equals the current second is already expired.
     */
    public TokenClaims validate(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is missing");
        }
        TokenClaims claims = parse(token);
        if (claims.type() != expectedType) {
            throw new TokenInvalidException("Expected a " + expectedType.claimValue() + " token");
        }
        if (!clock.instant().isBefore(claims.expiresAt())) {
            throw new TokenInvalidException("Token has expired");
        }
        if (revocationRegistry.isRevoked(claims.jti())) {
            throw new TokenInvalidException("Token has been revoked");
        }
        return claims;
    }

    public boolean revoke(String jti, Instant expiresAt) {
        return revocationRegistry.revoke(jti, expiresAt);
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private String mint(
            TokenType type,
            UUID userId,
            UUID applicationId,
            List<String> roles,
            List<String> scopes,
            Duration ttl,
            String jti,
            String sessionId
    ) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(applicationId, "applicationId");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant issuedAt = now();
        JwtKeyRing.SigningKey signingKey = keyRing.activeKey();

        JwtBuilder builder = Jwts.builder()
                .header().keyId(signingKey.keyId()).and()
                .id(jti)
                .issuer(issuer)
                .subject(userId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .claim(CLAIM_APPLICATION, applicationId.toString())
                .claim(CLAIM_TYPE, type.claimValue());
        if (roles != null) {
            builder.claim(CLAIM_ROLES, roles);
        }
        if (!scopes.isEmpty()) {
            builder.claim(CLAIM_SCOPES, scopes);
        }
        if (sessionId != null) {
            builder.claim(CLAIM_SESSION, sessionId);
        }
        return builder.signWith(signingKey.key(), SIG.HS256).compact();
    }

    private TokenClaims parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .keyLocator(new KeyRingLocator())
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            TokenType type = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class))
                    .orElseThrow(() -> new TokenInvalidException("Unknown token type"));
            String jti = claims.getId();
            String applicationId = claims.get(CLAIM_APPLICATION, String.class);
            if (jti == null || jti.isBlank() || claims.getSubject() == null || applicationId == null
                    || claims.getExpiration() == null || claims.getIssuedAt() == null) {
                throw new TokenInvalidException("Token is missing required claims");
            }
            List<String> roles = stringList(claims.get(CLAIM_ROLES, List.class));
            List<String> scopes = stringList(claims.get(CLAIM_SCOPES, List.class));

            return new TokenClaims(
                    jti,
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(applicationId),
                    type,
                    roles,
                    scopes,
                    claims.get(CLAIM_SESSION, String.class),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException("Invalid token", e);
        }
    }

    private static List<String> stringList(List<?> claim) {
        return claim == null ? List.of() : claim.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    private Instant now() {
        // JWT numeric dates carry whole seconds only
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static String newJti() {
        return UUID.randomUUID().toString();
    }

    private final class KeyRingLocator extends LocatorAdapter<Key> {

        @Override
        protected Key locate(ProtectedHeader header) {
            return keyRing.verificationKey(header.getKeyId())
                    .orElseThrow(() -> new TokenInvalidException("Unknown or retired signing key"));
        }
    }
}
