package com.secma.core.modules.auth.application;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.secma.core.modules.auth.domain.TokenType;

/**
 * Verified content of a token.
 *
 * @param scopes permissions the token was narrowed to at login, empty when it is not narrowed
 * @param sessionId jti of the refresh token minted together with an access token, null for refresh tokens
 */
public record TokenClaims(
        String jti,
        UUID subject,
        UUID applicationId,
        TokenType type,
        List<String> roles,
        List<String> scopes,
        String sessionId,
        Instant issuedAt,
        Instant expiresAt
) {

    public TokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean isScoped() {
        return !scopes.isEmpty();
    }

    /**
     * True when the token is not narrowed or was narrowed to a set containing {@code permission}.
     */
    public boolean coversScope(String permission) {
        return !isScoped() || scopes.contains(permission);
    }
}
