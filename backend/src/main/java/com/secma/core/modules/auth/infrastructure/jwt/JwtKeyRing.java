package com.secma.core.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import javax.crypto.SecretKey;

import com.secma.core.global.config.SecmaProperties;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HMAC signing keys. One key is active and signs new tokens; retired keys keep verifying tokens
 * for the grace period after they were replaced. The whole key set is swapped atomically so a
 * reader always sees either the old or the new set.
 */
@Component
public class JwtKeyRing {

    private static final Logger log = LoggerFactory.getLogger(JwtKeyRing.class);

    private final AtomicReference<KeySet> keys;
    private final Duration gracePeriod;
    private final Clock clock;

    public JwtKeyRing(SecmaProperties properties, Clock clock) {
        SecmaProperties.Token token = properties.token();
        this.clock = clock;
        this.gracePeriod = token.keyGracePeriod();

        SigningKey active = new SigningKey(token.keyId(), decodeSecret(token.keyId(), token.secret()));
        Instant now = clock.instant();
        Map<String, RetiredKey> retired = new LinkedHashMap<>();
        for (SecmaProperties.PreviousKey previous : token.previousKeys()) {
            if (previous.keyId().equals(active.keyId())) {
                throw new IllegalStateException("Previous key id '" + previous.keyId() + "' clashes with the active key");
            }
            retired.put(previous.keyId(), new RetiredKey(decodeSecret(previous.keyId(), previous.secret()), now));
        }
        this.keys = new AtomicReference<>(new KeySet(active, Map.copyOf(retired)));
        log.info("JWT key ring ready with active key '{}' and {} retired key(s)", active.keyId(), retired.size());
    }

    public SigningKey activeKey() {
        return keys.get().active();
    }

    /**
     * Key able to verify a token whose header names {@code keyId}. Retired keys are returned only
     * inside their grace window.
     */
    public Optional<SecretKey> verificationKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        KeySet current = keys.get();
        if (current.active().keyId().equals(keyId)) {
            return Optional.of(current.active().key());
        }
        RetiredKey retired = current.retired().get(keyId);
        if (retired == null || !clock.instant().isBefore(retired.retiredAt().plus(gracePeriod))) {
            return Optional.empty();
        }
        return Optional.of(retired.key());
    }

    /**
     * Installs a new active key. The previous active key is retired and keeps verifying tokens for
     * the configured grace period. Retired keys past their window are dropped.
     */
    public void rotate(String keyId, String secret) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be blank");
        }
        SecretKey key = decodeSecret(keyId, secret);
        Instant now = clock.instant();
        keys.updateAndGet(current -> {
            if (current.active().keyId().equals(keyId)) {
                throw new IllegalArgumentException("Key '" + keyId + "' is already active");
            }
            Map<String, RetiredKey> retired = new LinkedHashMap<>();
            current.retired().forEach((id, value) -> {
                if (!id.equals(keyId) && now.isBefore(value.retiredAt().plus(gracePeriod))) {
                    retired.put(id, value);
                }
            });
            retired.put(current.active().keyId(), new RetiredKey(current.active().key(), now));
            return new KeySet(new SigningKey(keyId, key), Map.copyOf(retired));
        });
        log.info("JWT signing key rotated to '{}'", keyId);
    }

    static SecretKey decodeSecret(String keyId, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret for key '" + keyId + "' is not configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Keys.hmacShaKeyFor(keyBytes);
        } catch (WeakKeyException ex) {
            throw new IllegalStateException("JWT secret for key '" + keyId + "' must be at least 256 bits", ex);
        }
    }

    public record SigningKey(String keyId, SecretKey key) {
    }

    private record RetiredKey(SecretKey key, Instant retiredAt) {
    }

    private record KeySet(SigningKey active, Map<String, RetiredKey> retired) {
    }
}
