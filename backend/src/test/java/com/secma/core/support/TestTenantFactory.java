package com.secma.core.support;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.secma.core.modules.auth.domain.Role;
import com.secma.core.modules.auth.domain.RoleGrant;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;
import com.secma.core.modules.auth.infrastructure.persistence.RoleRepository;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.modules.tenancy.infrastructure.persistence.ApplicationRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes fixtures straight through the repositories, bypassing the management services.
 */
@Component
@Transactional
public class TestTenantFactory {

    private final ApplicationRepository applicationRepository;
    private final SecmaUserRepository userRepository;
    private final RoleRepository roleRepository;
    private final RoleGrantRepository roleGrantRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public TestTenantFactory(
            ApplicationRepository applicationRepository,
            SecmaUserRepository userRepository,
            RoleRepository roleRepository,
            RoleGrantRepository roleGrantRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.roleGrantRepository = roleGrantRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public Application application(String name) {
        Application application = new Application();
        application.setName(name);
        application.setTitle(name.toUpperCase());
        return applicationRepository.save(application);
    }

    public SecmaUser user(Application application, String login, String rawPassword) {
        return userWithDigest(application, login, passwordEncoder.encode(rawPassword));
    }

    public SecmaUser userWithDigest(Application application, String login, String digest) {
        SecmaUser user = new SecmaUser();
        user.setApplication(application);
        user.setLogin(login);
        user.setPasswordHash(digest);
        return userRepository.save(user);
    }

    public Role role(Application application, String name, List<String> permissions) {
        Role role = new Role();
        role.setApplication(application);
        role.setName(name);
        role.replacePermissions(permissions);
        return roleRepository.save(role);
    }

    public RoleGrant grant(SecmaUser user, Role role) {
        RoleGrant grant = new RoleGrant();
        grant.setApplication(user.getApplication());
        grant.setUser(user);
        grant.setRole(role);
        grant.setGrantedAt(OffsetDateTime.now(clock));
        return roleGrantRepository.save(grant);
    }
}
