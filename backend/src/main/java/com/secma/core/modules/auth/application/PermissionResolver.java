package com.secma.core.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.secma.core.global.error.StoreFailures;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves what a user may do inside one application: the union of the permissions of every role
 * granted to them there. Always reads committed state, nothing is cached.
 */
@Service
public class PermissionResolver {

    private final RoleGrantRepository roleGrantRepository;

    public PermissionResolver(RoleGrantRepository roleGrantRepository) {
        this.roleGrantRepository = roleGrantRepository;
    }

    @Transactional(readOnly = true)
    public GrantedPermissions resolve(UUID userId, UUID applicationId) {
        if (SuperUserAccount.isSuperUser(userId)) {
            return GrantedPermissions.all();
        }
        try {
            List<String> permissions = roleGrantRepository.findPermissionsOf(userId, applicationId);
            return GrantedPermissions.of(permissions);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public boolean isPermitted(UUID userId, UUID applicationId, String permission) {
        return resolve(userId, applicationId).allows(permission);
    }
}
