package com.secma.core.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "secma.token", name = "prune-enabled", havingValue = "true", matchIfMissing = true)
public class RevokedTokenPruneScheduler {

    private static final Logger log = LoggerFactory.getLogger(RevokedTokenPruneScheduler.class);

    private final TokenRevocationRegistry tokenRevocationRegistry;

    public RevokedTokenPruneScheduler(TokenRevocationRegistry tokenRevocationRegistry) {
        this.tokenRevocationRegistry = tokenRevocationRegistry;
    }

    @Scheduled(fixedDelayString = "${secma.token.prune-interval:PT10M}")
    public void pruneExpiredRevocations() {
        try {
            int removed = tokenRevocationRegistry.pruneExpired();
            if (removed > 0) {
                log.info("Pruned {} expired token revocation(s)", removed);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to prune expired token revocations; skipping this cycle", ex);
        }
    }
}
