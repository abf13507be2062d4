package com.secma.core.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.UUID;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.InvalidCredentialsException;
import com.secma.core.global.error.InvalidInputException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.modules.auth.application.AuthService;
import com.secma.core.modules.auth.application.UserAdminService;
import com.secma.core.modules.auth.application.UserView;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.support.AbstractIntegrationTest;
import com.secma.core.support.TestTenantFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class UserAdminServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    UserAdminService userAdminService;

    @Autowired
    AuthService authService;

    @Autowired
    SecmaUserRepository userRepository;

    @Autowired
    TestTenantFactory tenants;

    private Application app;

    @BeforeEach
    void setUp() {
        app = tenants.application("docs");
    }

    @Test
    void createdUserCanLogIn() {
        UserView alice = userAdminService.create(app.getId(), "alice", "pw");

        assertThat(alice.enabled()).isTrue();
        assertThat(alice.applicationId()).isEqualTo(app.getId());
        assertThat(userRepository.findById(alice.id()).orElseThrow().getPasswordHash()).startsWith("{bcrypt}");
        assertThat(authService.login(app.getId(), "alice", "pw").accessToken()).isNotBlank();
    }

    @Test
    void loginsAreUniquePerApplication() {
        userAdminService.create(app.getId(), "alice", "pw");
        Application other = tenants.application("other");

        assertThrows(ConflictException.class, () -> userAdminService.create(app.getId(), "alice", "pw2"));
        assertThat(userAdminService.create(other.getId(), "alice", "pw").login()).isEqualTo("alice");
    }

    @Test
    void rejectsInvalidOrReservedLogins() {
        assertThrows(InvalidInputException.class, () -> userAdminService.create(app.getId(), "Alice", "pw"));
        assertThrows(InvalidInputException.class, () -> userAdminService.create(app.getId(), "alice", ""));
        assertThrows(ConflictException.class, () -> userAdminService.create(app.getId(), "super-user", "pw"));
        assertThrows(NotFoundException.class, () -> userAdminService.create(UUID.randomUUID(), "alice", "pw"));
    }

    @Test
    void disableAndEnableKeepTheAccount() {
        UserView alice = userAdminService.create(app.getId(), "alice", "pw");

        UserView disabled = userAdminService.disable(app.getId(), alice.id());
        assertThat(disabled.enabled()).isFalse();
        assertThat(disabled.disabledAt()).isNotNull();
        assertThrows(InvalidCredentialsException.class, () -> authService.login(app.getId(), "alice", "pw"));

        UserView enabled = userAdminService.enable(app.getId(), alice.id());
        assertThat(enabled.enabled()).isTrue();
        assertThat(enabled.disabledAt()).isNull();
        assertThat(authService.login(app.getId(), "alice", "pw").accessToken()).isNotBlank();
    }

    @Test
    void renameAndListing() {
        UserView alice = userAdminService.create(app.getId(), "alice", "pw");
        userAdminService.create(app.getId(), "bob", "pw");

        assertThrows(ConflictException.class, () -> userAdminService.rename(app.getId(), alice.id(), "bob"));
        userAdminService.rename(app.getId(), alice.id(), "alicia");

        assertThat(userAdminService.list(app.getId())).extracting(UserView::login).containsExactly("alicia", "bob");
        assertThat(userAdminService.get(app.getId(), alice.id()).login()).isEqualTo("alicia");
    }

    @Test
    void usersAreOnlyVisibleInTheirApplication() {
        UserView alice = userAdminService.create(app.getId(), "alice", "pw");
        Application other = tenants.application("other");

        assertThrows(NotFoundException.class, () -> userAdminService.get(other.getId(), alice.id()));
    }
}
