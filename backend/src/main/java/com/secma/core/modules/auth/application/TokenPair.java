package com.secma.core.modules.auth.application;

import java.time.Instant;

public record TokenPair(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        Instant issuedAt
) {

    public static final String DEFAULT_TOKEN_TYPE = "bearer";
}
