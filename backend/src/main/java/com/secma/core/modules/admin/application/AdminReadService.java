package com.secma.core.modules.admin.application;

import com.secma.core.global.error.StoreFailures;
import com.secma.core.modules.auth.infrastructure.persistence.RevokedTokenRepository;
import com.secma.core.modules.auth.infrastructure.persistence.RoleGrantRepository;
import com.secma.core.modules.auth.infrastructure.persistence.RoleRepository;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.infrastructure.persistence.ApplicationRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AdminReadService {

    private final ApplicationRepository applicationRepository;
    private final SecmaUserRepository userRepository;
    private final RoleRepository roleRepository;
    private final RoleGrantRepository roleGrantRepository;
    private final RevokedTokenRepository revokedTokenRepository;

    public AdminReadService(
            ApplicationRepository applicationRepository,
            SecmaUserRepository userRepository,
            RoleRepository roleRepository,
            RoleGrantRepository roleGrantRepository,
            RevokedTokenRepository revokedTokenRepository
    ) {
        this.applicationRepository = applicationRepository;
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.roleGrantRepository = roleGrantRepository;
        this.revokedTokenRepository = revokedTokenRepository;
    }

    /**
     * Counts read in one read-only transaction.
     */
    public StoreStatistics getStatistics() {
        try {
            return new StoreStatistics(
                    applicationRepository.count(),
                    applicationRepository.countWithoutUsers(),
                    userRepository.count(),
                    userRepository.countWithoutGrants(),
                    roleRepository.count(),
                    roleRepository.countWithoutPermissions(),
                    roleGrantRepository.count(),
                    revokedTokenRepository.count()
            );
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }
}
