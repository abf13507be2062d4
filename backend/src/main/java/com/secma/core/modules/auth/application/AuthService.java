package com.secma.core.modules.auth.application;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.secma.core.global.error.InvalidCredentialsException;
import com.secma.core.global.error.PermissionDeniedException;
import com.secma.core.global.error.StoreFailures;
import com.secma.core.global.error.TokenInvalidException;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.auth.domain.TokenType;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.modules.tenancy.infrastructure.persistence.ApplicationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Entry point of the transport layer: login, refresh, authorization and logout. Every identity is
 * passed in explicitly; nothing here reads an ambient current user.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    /** Role name placed in super-user access tokens. */
    public static final String SUPER_ROLE = "super";

    private final ApplicationRepository applicationRepository;
    private final SecmaUserRepository userRepository;
    private final RoleGrantRepository roleGrantRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final PermissionResolver permissionResolver;
    private final SuperUserAccount superUserAccount;

    public AuthService(
            ApplicationRepository applicationRepository,
            SecmaUserRepository userRepository,
            RoleGrantRepository roleGrantRepository,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService,
            PermissionResolver permissionResolver,
            SuperUserAccount superUserAccount
    ) {
        this.applicationRepository = applicationRepository;
        this.userRepository = userRepository;
        this.roleGrantRepository = roleGrantRepository;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.permissionResolver = permissionResolver;
        this.superUserAccount = superUserAccount;
    }

    /**
     * Every failure (unknown or disabled application, unknown or disabled user, wrong password)
     * raises the same {@link InvalidCredentialsException}. The actual reason is only logged.
     */
    public TokenPair login(UUID applicationId, String login, String password) {
        return login(applicationId, login, password, Set.of());
    }

    /**
     * Logs in and narrows both tokens to {@code requestedScopes}. Every requested permission must
     * currently be held by the user, otherwise the login fails like any other. An empty collection
     * requests no narrowing.
     */
    public TokenPair login(UUID applicationId, String login, String password, Collection<String> requestedScopes) {
        Set<String> scopes = requestedScopes == null ? Set.of() : new TreeSet<>(requestedScopes);
        String traceId = newTraceId();
        if (applicationId == null || login == null || password == null) {
            passwordHasher.verifyDummy(password);
            throw rejectLogin(traceId, applicationId, login, "incomplete credentials");
        }

        Optional<Application> application = findApplication(applicationId);

        if (superUserAccount.matchesLogin(login)) {
            if (!superUserAccount.verifyPassword(password)) {
                throw rejectLogin(traceId, applicationId, login, "wrong super-user password");
            }
            if (application.isEmpty()) {
                throw rejectLogin(traceId, applicationId, login, "unknown application");
            }
            log.info("Super-user logged in to application {}", applicationId);
            return jwtTokenService.issueTokenPair(SuperUserAccount.SUBJECT_ID, applicationId, List.of(SUPER_ROLE), scopes);
        }

        if (application.isEmpty() || !application.get().isEnabled()) {
            passwordHasher.verifyDummy(password);
            throw rejectLogin(traceId, applicationId, login,
                    application.isEmpty() ? "unknown application" : "application disabled");
        }

        Optional<SecmaUser> found = findUser(applicationId, login);
        if (found.isEmpty()) {
            passwordHasher.verifyDummy(password);
            throw rejectLogin(traceId, applicationId, login, "unknown user");
        }

        SecmaUser user = found.get();
        boolean passwordMatches = passwordHasher.verify(password, user.getPasswordHash());
        if (!user.isEnabled()) {
            throw rejectLogin(traceId, applicationId, login, "user disabled");
        }
        if (!passwordMatches) {
            throw rejectLogin(traceId, applicationId, login, "wrong password");
        }

        if (passwordHasher.needsRehash(user.getPasswordHash())) {
            rehash(user, password);
        }

        if (!scopes.isEmpty()) {
            Set<String> missing = new TreeSet<>(scopes);
            missing.removeIf(permissionResolver.resolve(user.getId(), applicationId)::allows);
            if (!missing.isEmpty()) {
                throw rejectLogin(traceId, applicationId, login, "requested scopes not held " + missing);
            }
        }

        List<String> roles = roleNamesOf(user.getId(), applicationId);
        log.debug("User {} logged in to application {}", user.getId(), applicationId);
        return jwtTokenService.issueTokenPair(user.getId(), applicationId, roles, scopes);
    }

    /**
     * Exchanges a refresh token for a new token pair. The presented refresh token is revoked, so it
     * can be used once. Roles are resolved again from the store; scopes carry over unchanged.
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = jwtTokenService.validate(refreshToken, TokenType.REFRESH);
        UUID applicationId = claims.applicationId();

        List<String> roles;
        if (SuperUserAccount.isSuperUser(claims.subject())) {
            if (!superUserAccount.isEnabled() || findApplication(applicationId).isEmpty()) {
                throw new TokenInvalidException("Token subject is no longer valid");
            }
            roles = List.of(SUPER_ROLE);
        } else {
            SecmaUser user = findActiveUser(applicationId, claims.subject())
                    .orElseThrow(() -> new TokenInvalidException("Token subject is no longer valid"));
            roles = roleNamesOf(user.getId(), applicationId);
        }

        if (!jwtTokenService.revoke(claims.jti(), claims.expiresAt())) {
            log.warn("Refresh token {} of subject {} was presented again after use", claims.jti(), claims.subject());
            throw new TokenInvalidException("Token has been revoked");
        }
        return jwtTokenService.issueTokenPair(claims.subject(), applicationId, roles, claims.scopes());
    }

    /**
     * Validates the access token and checks that its subject holds {@code requiredPermission} in
     * the token's application. A narrowed token must also list the permission among its scopes.
     * Apart from that the super-user passes every check.
     */
    public TokenClaims authorize(String accessToken, String requiredPermission) {
        TokenClaims claims = jwtTokenService.validate(accessToken, TokenType.ACCESS);
        boolean inScope = requiredPermission != null && claims.coversScope(requiredPermission);
        if (inScope && SuperUserAccount.isSuperUser(claims.subject())) {
            return claims;
        }
        if (!inScope
                || !permissionResolver.isPermitted(claims.subject(), claims.applicationId(), requiredPermission)) {
            String traceId = newTraceId();
            log.info("Permission {} denied to user {} in application {} (trace ID: {})",
                    requiredPermission, claims.subject(), claims.applicationId(), traceId);
            throw new PermissionDeniedException(requiredPermission, traceId);
        }
        return claims;
    }

    /**
     * Revokes the access token and the refresh token minted with it.
     */
    public void logout(String accessToken) {
        TokenClaims claims = jwtTokenService.validate(accessToken, TokenType.ACCESS);
        jwtTokenService.revoke(claims.jti(), claims.expiresAt());
        if (claims.sessionId() != null) {
            Instant refreshExpiry = claims.issuedAt().plus(jwtTokenService.getRefreshTokenTtl());
            jwtTokenService.revoke(claims.sessionId(), refreshExpiry);
        }
        log.debug("Subject {} logged out of application {}", claims.subject(), claims.applicationId());
    }

    private InvalidCredentialsException rejectLogin(String traceId, UUID applicationId, String login, String reason) {
        log.info("Login rejected for '{}' in application {}: {} (trace ID: {})", login, applicationId, reason, traceId);
        return new InvalidCredentialsException(traceId);
    }

    private Optional<Application> findApplication(UUID applicationId) {
        try {
            return applicationRepository.findById(applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private Optional<SecmaUser> findUser(UUID applicationId, String login) {
        try {
            return userRepository.findByApplicationAndLogin(applicationId, login);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private Optional<SecmaUser> findActiveUser(UUID applicationId, UUID userId) {
        try {
            return userRepository.findInApplication(applicationId, userId)
                    .filter(SecmaUser::isEnabled)
                    .filter(user -> user.getApplication().isEnabled());
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private List<String> roleNamesOf(UUID userId, UUID applicationId) {
        try {
            return roleGrantRepository.findRoleNamesOf(userId, applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private void rehash(SecmaUser user, String password) {
        try {
            user.setPasswordHash(passwordHasher.hash(password));
            userRepository.save(user);
            log.info("Upgraded password digest of user {}", user.getId());
        } catch (DataAccessException ex) {
            log.warn("Could not upgrade password digest of user {}", user.getId(), ex);
        }
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString();
    }
}
