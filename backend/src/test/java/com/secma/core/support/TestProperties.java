package com.secma.core.support;

import java.time.Duration;
import java.util.List;

import com.secma.core.global.config.SecmaProperties;

public final class TestProperties {

    public static final String SECRET = "unit-test-signing-secret-with-at-least-32-bytes";

    private TestProperties() {
    }

    public static SecmaProperties withToken(SecmaProperties.Token token) {
        return new SecmaProperties(
                token,
                new SecmaProperties.SuperUser("super-user", "super-pass"),
                new SecmaProperties.Password(4),
                new SecmaProperties.Store("secma_", "")
        );
    }

    public static SecmaProperties defaults() {
        return withToken(token(SECRET, List.of()));
    }

    public static SecmaProperties withBcryptStrength(int strength) {
        SecmaProperties base = defaults();
        return new SecmaProperties(base.token(), base.superUser(), new SecmaProperties.Password(strength), base.store());
    }

    public static SecmaProperties.Token token(String secret, List<SecmaProperties.PreviousKey> previousKeys) {
        return new SecmaProperties.Token(
                secret,
                "key-1",
                previousKeys,
                Duration.ofHours(1),
                Duration.ofMinutes(15),
                Duration.ofDays(7),
                "secma",
                false,
                Duration.ofMinutes(10)
        );
    }
}
