package com.secma.core.modules.auth.application;

import java.util.UUID;

import com.secma.core.global.config.SecmaProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The configured global identity. It is not stored; its tokens carry the reserved
 * {@link #SUBJECT_ID} as subject and every permission check passes for it.
 */
@Component
public class SuperUserAccount {

    private static final Logger log = LoggerFactory.getLogger(SuperUserAccount.class);

    /** Reserved subject. Stored user ids are random UUIDs and never collide with it. */
    public static final UUID SUBJECT_ID = new UUID(0L, 0L);

    private final String login;
    private final String passwordDigest;
    private final PasswordHasher passwordHasher;

    public SuperUserAccount(SecmaProperties properties, PasswordHasher passwordHasher) {
        SecmaProperties.SuperUser superUser = properties.superUser();
        this.login = superUser.login();
        this.passwordHasher = passwordHasher;
        if (!superUser.isConfigured()) {
            this.passwordDigest = null;
            log.warn("No super-user password configured; super-user login is disabled");
        } else if (PasswordHasher.isDigest(superUser.password())) {
            this.passwordDigest = PasswordHasher.normalizeDigest(superUser.password());
        } else {
            this.passwordDigest = passwordHasher.hash(superUser.password());
        }
    }

    public static boolean isSuperUser(UUID subject) {
        return SUBJECT_ID.equals(subject);
    }

    public boolean isEnabled() {
        return passwordDigest != null;
    }

    public boolean matchesLogin(String candidate) {
        return isEnabled() && login.equals(candidate);
    }

    public boolean verifyPassword(String plaintext) {
        return isEnabled() && passwordHasher.verify(plaintext, passwordDigest);
    }

    public String getLogin() {
        return login;
    }
}
