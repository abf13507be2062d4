package com.secma.core.modules.auth.application;

import java.util.UUID;
import java.util.regex.Pattern;

import com.secma.core.global.security.PasswordEncoderConfig;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted, deliberately expensive password digests. Digests are self-describing
 * ({@code {bcrypt}$2a$10$...}) so the algorithm and cost can change without a migration.
 */
@Component
public class PasswordHasher {

    private static final String ID_PREFIX = "{" + PasswordEncoderConfig.BCRYPT_ID + "}";
    private static final Pattern BARE_BCRYPT = Pattern.compile("\\A\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}\\z");

    private final PasswordEncoder passwordEncoder;
    private final String dummyDigest;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyDigest = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Never throws. A null, malformed or unknown digest simply does not match.
     */
    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * True when the digest was produced by another algorithm or with a lower cost than the
     * configured one.
     */
    public boolean needsRehash(String digest) {
        if (digest == null || digest.isBlank()) {
            return true;
        }
        try {
            return passwordEncoder.upgradeEncoding(digest);
        } catch (IllegalArgumentException ex) {
            return true;
        }
    }

    /**
     * Burns roughly the same time as a real verification. Used when there is no stored digest to
     * compare against.
     */
    public void verifyDummy(String plaintext) {
        verify(plaintext == null ? "" : plaintext, dummyDigest);
    }

    /**
     * Whether the value already is a digest: either carries the {@code {bcrypt}} prefix or is a
     * well-formed bare bcrypt hash. Anything else is a plaintext password, even if it starts
     * with {@code $2}.
     */
    public static boolean isDigest(String value) {
        return value != null && (value.startsWith(ID_PREFIX) || BARE_BCRYPT.matcher(value).matches());
    }

    public static String normalizeDigest(String digest) {
        return digest.startsWith(ID_PREFIX) ? digest : ID_PREFIX + digest;
    }
}
