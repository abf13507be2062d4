package com.secma.core.modules.tenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.ErrorKind;
import com.secma.core.global.error.InvalidInputException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.modules.auth.application.PermissionResolver;
import com.secma.core.modules.auth.domain.Role;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.tenancy.application.ApplicationService;
import com.secma.core.modules.tenancy.application.ApplicationView;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.support.AbstractIntegrationTest;
import com.secma.core.support.TestTenantFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ApplicationServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    ApplicationService applicationService;

    @Autowired
    PermissionResolver permissionResolver;

    @Autowired
    TestTenantFactory tenants;

    @Test
    void createsAndListsApplications() {
        ApplicationView billing = applicationService.create("billing", "Billing", "Invoices and payments");
        applicationService.create("archive", null, null);

        assertThat(billing.id()).isNotNull();
        assertThat(billing.enabled()).isTrue();
        assertThat(billing.createdAt()).isNotNull();
        assertThat(applicationService.get(billing.id()).title()).isEqualTo("Billing");
        assertThat(applicationService.list()).extracting(ApplicationView::name)
                .containsExactly("archive", "billing");
    }

    @Test
    void rejectsInvalidNames() {
        assertThrows(InvalidInputException.class, () -> applicationService.create("ab", null, null));
        assertThrows(InvalidInputException.class, () -> applicationService.create("Billing", null, null));
        assertThrows(InvalidInputException.class, () -> applicationService.create("bill ing", null, null));
        InvalidInputException empty = assertThrows(InvalidInputException.class,
                () -> applicationService.create("", null, null));
        assertThat(empty.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(empty.getField()).isEqualTo("name");
    }

    @Test
    void duplicateNameConflicts() {
        ApplicationView first = applicationService.create("billing", null, null);
        ApplicationView second = applicationService.create("shipping", null, null);

        assertThrows(ConflictException.class, () -> applicationService.create("billing", null, null));
        assertThrows(ConflictException.class,
                () -> applicationService.update(second.id(), "billing", null, null));
        assertThat(applicationService.update(first.id(), "billing", "Renamed", null).title()).isEqualTo("Renamed");
    }

    @Test
    void deleteRefusesApplicationsInUse() {
        Application docs = tenants.application("docs");
        tenants.user(docs, "alice", "pw");
        Application empty = tenants.application("empty");

        ConflictException conflict = assertThrows(ConflictException.class,
                () -> applicationService.delete(docs.getId()));
        assertThat(conflict.getKind()).isEqualTo(ErrorKind.CONFLICT);

        applicationService.delete(empty.getId());
        assertThrows(NotFoundException.class, () -> applicationService.get(empty.getId()));
    }

    @Test
    void disabledApplicationResolvesNoPermissions() {
        Application docs = tenants.application("docs");
        SecmaUser alice = tenants.user(docs, "alice", "pw");
        Role editor = tenants.role(docs, "editor", List.of("doc:read"));
        tenants.grant(alice, editor);

        applicationService.setEnabled(docs.getId(), false);
        assertThat(permissionResolver.resolve(alice.getId(), docs.getId()).permissions()).isEmpty();

        applicationService.setEnabled(docs.getId(), true);
        assertThat(permissionResolver.resolve(alice.getId(), docs.getId()).permissions()).containsExactly("doc:read");
    }
}
