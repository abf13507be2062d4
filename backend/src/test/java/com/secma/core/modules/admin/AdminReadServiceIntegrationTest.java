package com.secma.core.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.secma.core.modules.admin.application.AdminReadService;
import com.secma.core.modules.admin.application.StoreStatistics;
import com.secma.core.modules.auth.application.TokenRevocationRegistry;
import com.secma.core.modules.auth.domain.Role;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.support.AbstractIntegrationTest;
import com.secma.core.support.TestTenantFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AdminReadServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    AdminReadService adminReadService;

    @Autowired
    TokenRevocationRegistry revocationRegistry;

    @Autowired
    TestTenantFactory tenants;

    @Test
    void emptyStoreCountsNothing() {
        assertThat(adminReadService.getStatistics())
                .isEqualTo(new StoreStatistics(0, 0, 0, 0, 0, 0, 0, 0));
    }

    @Test
    void countsEveryKindOfRecord() {
        Application docs = tenants.application("docs");
        tenants.application("unused");
        SecmaUser alice = tenants.user(docs, "alice", "pw");
        tenants.user(docs, "bob", "pw");
        Role editor = tenants.role(docs, "editor", List.of("doc:read", "doc:write"));
        tenants.role(docs, "placeholder", List.of());
        tenants.grant(alice, editor);
        revocationRegistry.revoke("jti-1", Instant.now().plus(Duration.ofMinutes(5)));

        StoreStatistics statistics = adminReadService.getStatistics();

        assertThat(statistics.applications()).isEqualTo(2);
        assertThat(statistics.applicationsWithoutUsers()).isEqualTo(1);
        assertThat(statistics.users()).isEqualTo(2);
        assertThat(statistics.usersWithoutGrants()).isEqualTo(1);
        assertThat(statistics.roles()).isEqualTo(2);
        assertThat(statistics.rolesWithoutPermissions()).isEqualTo(1);
        assertThat(statistics.grants()).isEqualTo(1);
        assertThat(statistics.revokedTokens()).isEqualTo(1);
    }
}
