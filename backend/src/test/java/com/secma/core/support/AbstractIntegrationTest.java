package com.secma.core.support;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import javax.sql.DataSource;

import com.secma.core.global.config.SecmaProperties;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates it when each
 * context starts, under that context's table prefix and schema. Without a Docker daemon the tests
 * fall back to the in-memory H2 database configured in the test {@code application.yml}.
 * <p>
 * Every table is emptied after each test, children first.
 */
public abstract class AbstractIntegrationTest {

    private static final String[] TABLES_IN_DELETE_ORDER = {
            "grants",
            "role_permissions",
            "roles",
            "users",
            "applications",
            "revoked_tokens"
    };

    private static final PostgreSQLContainer<?> POSTGRES;

    static {
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
                    .withDatabaseName("secma_test")
                    .withUsername("secma")
                    .withPassword("secma");
            POSTGRES.start();
        } else {
            System.out.println("[testcontainers] Docker is not available, integration tests run on H2");
            POSTGRES = null;
        }
    }

    @Autowired
    private DataSource dataSource;

    @Autowired
    private SecmaProperties properties;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        if (POSTGRES == null) {
            return;
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    protected static boolean runsOnPostgres() {
        return POSTGRES != null;
    }

    @AfterEach
    void wipeStore() {
        SecmaProperties.Store store = properties.store();
        String qualifier = store.hasSchema() ? store.schema() + "." : "";
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            for (String table : TABLES_IN_DELETE_ORDER) {
                stmt.executeUpdate("DELETE FROM " + qualifier + store.tablePrefix() + table);
            }
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to wipe the store after test", ex);
        }
    }
}
