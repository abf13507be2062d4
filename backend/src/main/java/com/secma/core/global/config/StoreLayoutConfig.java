package com.secma.core.global.config;

import java.util.Map;

import org.hibernate.boot.model.naming.PhysicalNamingStrategy;
import org.hibernate.cfg.AvailableSettings;
import org.springframework.boot.autoconfigure.flyway.FlywayConfigurationCustomizer;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Applies {@code secma.store.*} to both Hibernate and Flyway: table prefix and schema namespace.
 * Migrations reference the prefix through the {@code ${prefix}} placeholder.
 */
@Configuration
public class StoreLayoutConfig {

    static final String PREFIX_PLACEHOLDER = "prefix";
    static final String HISTORY_TABLE = "schema_history";

    @Bean
    public PhysicalNamingStrategy prefixedPhysicalNamingStrategy(SecmaProperties properties) {
        return new PrefixedPhysicalNamingStrategy(properties.store().tablePrefix());
    }

    @Bean
    public HibernatePropertiesCustomizer storeSchemaCustomizer(SecmaProperties properties) {
        SecmaProperties.Store store = properties.store();
        return hibernateProperties -> {
            if (store.hasSchema()) {
                hibernateProperties.put(AvailableSettings.DEFAULT_SCHEMA, store.schema());
            }
        };
    }

    @Bean
    public FlywayConfigurationCustomizer storeLayoutFlywayCustomizer(SecmaProperties properties) {
        SecmaProperties.Store store = properties.store();
        return configuration -> {
            configuration.placeholders(Map.of(PREFIX_PLACEHOLDER, store.tablePrefix()));
            configuration.table(store.tablePrefix() + HISTORY_TABLE);
            if (store.hasSchema()) {
                configuration.schemas(store.schema());
                configuration.defaultSchema(store.schema());
            }
        };
    }
}
