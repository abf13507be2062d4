package com.secma.core.global.config;

import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;

/**
 * Prepends the configured table prefix to every physical table name, so several deployments can
 * share one database without collisions.
 */
public class PrefixedPhysicalNamingStrategy extends CamelCaseToUnderscoresNamingStrategy {

    private final String tablePrefix;

    public PrefixedPhysicalNamingStrategy(String tablePrefix) {
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
    }

    @Override
    public Identifier toPhysicalTableName(Identifier logicalName, JdbcEnvironment jdbcEnvironment) {
        Identifier name = super.toPhysicalTableName(logicalName, jdbcEnvironment);
        if (name == null || tablePrefix.isEmpty()) {
            return name;
        }
        return Identifier.toIdentifier(tablePrefix + name.getText(), name.isQuoted());
    }
}
