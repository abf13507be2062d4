package com.secma.core.global.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.secma.core.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class StoreLayoutIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void everyTableCarriesThePrefix() {
        List<String> tables = jdbcTemplate.queryForList("""
                SELECT LOWER(table_name)
                  FROM information_schema.tables
                 WHERE LOWER(table_schema) = 'public'
                """, String.class);

        assertThat(tables).contains(
                "secma_applications",
                "secma_users",
                "secma_roles",
                "secma_role_permissions",
                "secma_grants",
                "secma_revoked_tokens",
                "secma_schema_history"
        );
        assertThat(tables).allMatch(name -> name.startsWith("secma_"));
    }

    @Test
    void migrationIsRecordedInPrefixedHistoryTable() {
        Integer applied = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM secma_schema_history WHERE success = TRUE AND version = '1'", Integer.class);

        assertThat(applied).isEqualTo(1);
    }
}
