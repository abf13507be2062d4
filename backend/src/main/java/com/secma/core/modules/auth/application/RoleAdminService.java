package com.secma.core.modules.auth.application;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.global.error.StoreFailures;
import com.secma.core.global.validation.Identifiers;
import com.secma.core.modules.auth.domain.Role;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;
import com.secma.core.modules.auth.infrastructure.persistence.RoleRepository;
import com.secma.core.modules.tenancy.application.ApplicationService;
import com.secma.core.modules.tenancy.domain.Application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Roles and their permission lists. Each mutation is a single transaction, so permission
 * resolution sees either the old or the new permission list of a role.
 */
@Service
@Transactional
public class RoleAdminService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdminService.class);

    private final RoleRepository roleRepository;
    private final RoleGrantRepository roleGrantRepository;
    private final ApplicationService applicationService;

    public RoleAdminService(
            RoleRepository roleRepository,
            RoleGrantRepository roleGrantRepository,
            ApplicationService applicationService
    ) {
        this.roleRepository = roleRepository;
        this.roleGrantRepository = roleGrantRepository;
        this.applicationService = applicationService;
    }

    public RoleView create(@NonNull UUID applicationId, String name, String description, Collection<String> permissions) {
        String checkedName = Identifiers.roleName(name);
        Identifiers.optionalText("description", description);
        Set<String> checkedPermissions = checkPermissions(permissions);
        Application application = applicationService.requireApplication(applicationId);
        try {
            if (roleRepository.existsByApplicationIdAndName(applicationId, checkedName)) {
                throw nameTaken(checkedName);
            }
            Role role = new Role();
            role.setApplication(application);
            role.setName(checkedName);
            role.setDescription(description);
            role.replacePermissions(checkedPermissions);
            Role saved = roleRepository.saveAndFlush(role);
            log.info("Created role {} ({}) in application {}", saved.getName(), saved.getId(), applicationId);
            return RoleView.from(saved);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public RoleView get(@NonNull UUID applicationId, @NonNull UUID roleId) {
        return RoleView.from(requireRole(applicationId, roleId));
    }

    @Transactional(readOnly = true)
    public List<RoleView> list(@NonNull UUID applicationId) {
        applicationService.requireApplication(applicationId);
        try {
            return roleRepository.findAllInApplication(applicationId).stream()
                    .map(RoleView::from)
                    .toList();
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public RoleView rename(@NonNull UUID applicationId, @NonNull UUID roleId, String name, String description) {
        String checkedName = Identifiers.roleName(name);
        Identifiers.optionalText("description", description);
        Role role = requireRole(applicationId, roleId);
        try {
            if (!checkedName.equals(role.getName())
                    && roleRepository.existsByApplicationIdAndName(applicationId, checkedName)) {
                throw nameTaken(checkedName);
            }
            role.setName(checkedName);
            role.setDescription(description);
            return RoleView.from(roleRepository.saveAndFlush(role));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public RoleView replacePermissions(@NonNull UUID applicationId, @NonNull UUID roleId, Collection<String> permissions) {
        Set<String> checkedPermissions = checkPermissions(permissions);
        Role role = requireRole(applicationId, roleId);
        role.replacePermissions(checkedPermissions);
        return RoleView.from(save(role));
    }

    /**
     * Adds one permission. Adding a permission the role already holds changes nothing.
     */
    public RoleView addPermission(@NonNull UUID applicationId, @NonNull UUID roleId, String permission) {
        String checked = Identifiers.permission(permission);
        Role role = requireRole(applicationId, roleId);
        if (!role.addPermission(checked)) {
            return RoleView.from(role);
        }
        return RoleView.from(save(role));
    }

    public RoleView removePermission(@NonNull UUID applicationId, @NonNull UUID roleId, String permission) {
        Role role = requireRole(applicationId, roleId);
        if (!role.removePermission(permission)) {
            throw new NotFoundException("role.permission_not_found",
                    "Role `" + role.getName() + "` does not hold permission `" + permission + "`.");
        }
        return RoleView.from(save(role));
    }

    /**
     * Deletes the role together with every grant of it, in one transaction.
     */
    public void delete(@NonNull UUID applicationId, @NonNull UUID roleId) {
        Role role = requireRole(applicationId, roleId);
        try {
            int grants = roleGrantRepository.deleteAllOfRole(roleId);
            roleRepository.delete(role);
            roleRepository.flush();
            log.info("Deleted role {} ({}) and {} grant(s) in application {}", role.getName(), roleId, grants, applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public Role requireRole(UUID applicationId, UUID roleId) {
        applicationService.requireApplication(applicationId);
        try {
            return roleRepository.findInApplication(applicationId, roleId)
                    .orElseThrow(() -> new NotFoundException("role.not_found",
                            "Role " + roleId + " does not exist in application " + applicationId + "."));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private Role save(Role role) {
        try {
            return roleRepository.saveAndFlush(role);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private static Set<String> checkPermissions(Collection<String> permissions) {
        Set<String> checked = new LinkedHashSet<>();
        if (permissions != null) {
            for (String permission : permissions) {
                checked.add(Identifiers.permission(permission));
            }
        }
        return checked;
    }

    private static ConflictException nameTaken(String name) {
        return new ConflictException("role.name_taken", "The role name `" + name + "` is taken.");
    }
}
