package com.secma.core.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background jobs are optional; tests switch them off with {@code secma.token.prune-enabled=false}.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "secma.token.prune-enabled", havingValue = "true", matchIfMissing = true)
@EnableScheduling
public class SchedulingConfig {
}
