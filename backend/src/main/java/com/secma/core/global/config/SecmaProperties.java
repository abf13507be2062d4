package com.secma.core.global.config;

import java.time.Duration;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Resolved settings of the authorization core, bound from the {@code secma.*} prefix.
 *
 * <p>Spring Boot resolves the value from its ordered property sources: {@code application.yml},
 * then an optional {@code ./config/secma.yml}, then docker secrets mounted under
 * {@code /run/secrets} (one file per property, e.g. {@code secma.token.secret}), then environment
 * variables such as {@code SECMA_TOKEN_SECRET}. Later sources win field by field. The bound record is
 * immutable and validated once at startup; invalid settings stop the context.
 *
 * <pre>
 * secma:
 *   token:
 *     secret: ...
 *     access-ttl: PT15M
 *     refresh-ttl: P7D
 *   super-user:
 *     login: super-user
 *     password: ...
 *   store:
 *     table-prefix: secma_
 *     schema: ""
 * </pre>
 */
@ConfigurationProperties(prefix = "secma")
@Validated
public record SecmaProperties(
        @Valid @NotNull @DefaultValue Token token,
        @Valid @NotNull @DefaultValue SuperUser superUser,
        @Valid @NotNull @DefaultValue Password password,
        @Valid @NotNull @DefaultValue Store store
) {

    /**
     * @param secret active HMAC signing secret, base64 or raw text, at least 256 bits
     * @param keyId identifier of the active key, written to the {@code kid} header
     * @param previousKeys retired keys that still verify tokens during the grace period
     * @param keyGracePeriod how long a retired key keeps verifying tokens
     * @param accessTtl lifetime of access tokens
     * @param refreshTtl lifetime of refresh tokens
     * @param issuer value of the {@code iss} claim
     * @param pruneEnabled whether expired revocation rows are pruned periodically
     * @param pruneInterval delay between two prune runs
     */
    public record Token(
            @NotBlank String secret,
            @DefaultValue("primary") @NotBlank String keyId,
            List<PreviousKey> previousKeys,
            @DefaultValue("PT1H") @NotNull Duration keyGracePeriod,
            @DefaultValue("PT15M") @NotNull Duration accessTtl,
            @DefaultValue("P7D") @NotNull Duration refreshTtl,
            @DefaultValue("secma") @NotBlank String issuer,
            @DefaultValue("true") boolean pruneEnabled,
            @DefaultValue("PT10M") @NotNull Duration pruneInterval
    ) {

        public Token {
            if (previousKeys == null) {
                previousKeys = List.of();
            } else {
                previousKeys = List.copyOf(previousKeys);
            }
        }
    }

    public record PreviousKey(@NotBlank String keyId, @NotBlank String secret) {
    }

    /**
     * The global identity that holds every permission. Login is disabled while the password is blank.
     * The password may be given in plain text or as a {@code {bcrypt}} digest.
     */
    public record SuperUser(
            @DefaultValue("super-user") @NotBlank String login,
            String password
    ) {

        public boolean isConfigured() {
            return password != null && !password.isBlank();
        }
    }

    public record Password(
            @DefaultValue("10") @Min(4) @Max(31) int bcryptStrength
    ) {
    }

    /**
     * @param tablePrefix prepended to every table, index and the migration history table
     * @param schema database schema holding the tables; blank means the connection default
     */
    public record Store(
            @DefaultValue("secma_") @Pattern(regexp = "[a-z0-9_]*") String tablePrefix,
            @DefaultValue("") String schema
    ) {

        public boolean hasSchema() {
            return schema != null && !schema.isBlank();
        }
    }
}
