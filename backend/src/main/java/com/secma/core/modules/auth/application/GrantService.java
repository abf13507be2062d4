package com.secma.core.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.global.error.StoreFailures;
import com.secma.core.modules.auth.domain.Role;
import com.secma.core.modules.auth.domain.RoleGrant;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grants link a user to a role of the same application. The user and the role are both looked up
 * inside the given application, so a grant can never cross tenants.
 */
@Service
@Transactional
public class GrantService {

    private static final Logger log = LoggerFactory.getLogger(GrantService.class);

    private final RoleGrantRepository roleGrantRepository;
    private final UserAdminService userAdminService;
    private final RoleAdminService roleAdminService;
    private final Clock clock;

    public GrantService(
            RoleGrantRepository roleGrantRepository,
            UserAdminService userAdminService,
            RoleAdminService roleAdminService,
            Clock clock
    ) {
        this.roleGrantRepository = roleGrantRepository;
        this.userAdminService = userAdminService;
        this.roleAdminService = roleAdminService;
        this.clock = clock;
    }

    public GrantView grant(@NonNull UUID applicationId, @NonNull UUID userId, @NonNull UUID roleId) {
        SecmaUser user = userAdminService.requireUser(applicationId, userId);
        Role role = roleAdminService.requireRole(applicationId, roleId);
        try {
            if (roleGrantRepository.existsByUserIdAndRoleId(userId, roleId)) {
                throw new ConflictException("grant.already_exists",
                        "Role `" + role.getName() + "` is already granted to user " + userId + ".");
            }
            RoleGrant grant = new RoleGrant();
            grant.setApplication(user.getApplication());
            grant.setUser(user);
            grant.setRole(role);
            grant.setGrantedAt(OffsetDateTime.now(clock));
            RoleGrant saved = roleGrantRepository.saveAndFlush(grant);
            log.info("Granted role {} to user {} in application {}", role.getName(), userId, applicationId);
            return GrantView.from(saved);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public void revoke(@NonNull UUID applicationId, @NonNull UUID userId, @NonNull UUID roleId) {
        try {
            RoleGrant grant = roleGrantRepository.findGrant(applicationId, userId, roleId)
                    .orElseThrow(() -> new NotFoundException("grant.not_found",
                            "Role " + roleId + " is not granted to user " + userId + "."));
            roleGrantRepository.delete(grant);
            roleGrantRepository.flush();
            log.info("Revoked role {} from user {} in application {}", roleId, userId, applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public List<GrantView> listForUser(@NonNull UUID applicationId, @NonNull UUID userId) {
        userAdminService.requireUser(applicationId, userId);
        try {
            return roleGrantRepository.findAllOfUser(userId, applicationId).stream()
                    .map(GrantView::from)
                    .toList();
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public List<String> listRoleNames(@NonNull UUID applicationId, @NonNull UUID userId) {
        userAdminService.requireUser(applicationId, userId);
        try {
            return roleGrantRepository.findRoleNamesOf(userId, applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }
}
