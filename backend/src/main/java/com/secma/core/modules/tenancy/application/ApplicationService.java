package com.secma.core.modules.tenancy.application;

import java.util.List;
import java.util.UUID;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.global.error.StoreFailures;
import com.secma.core.global.validation.Identifiers;
import com.secma.core.modules.auth.infrastructure.persistence.RoleRepository;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.domain.Application;
import com.secma.core.modules.tenancy.infrastructure.persistence.ApplicationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ApplicationService {

    private static final Logger log = LoggerFactory.getLogger(ApplicationService.class);

    private final ApplicationRepository applicationRepository;
    private final SecmaUserRepository userRepository;
    private final RoleRepository roleRepository;

    public ApplicationService(
            ApplicationRepository applicationRepository,
            SecmaUserRepository userRepository,
            RoleRepository roleRepository
    ) {
        this.applicationRepository = applicationRepository;
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
    }

    public ApplicationView create(String name, String title, String description) {
        String checkedName = Identifiers.applicationName(name);
        Identifiers.optionalText("title", title);
        Identifiers.optionalText("description", description);
        try {
            if (applicationRepository.existsByName(checkedName)) {
                throw nameTaken(checkedName);
            }
            Application application = new Application();
            application.setName(checkedName);
            application.setTitle(title);
            application.setDescription(description);
            Application saved = applicationRepository.saveAndFlush(application);
            log.info("Created application {} ({})", saved.getName(), saved.getId());
            return ApplicationView.from(saved);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public ApplicationView get(@NonNull UUID applicationId) {
        return ApplicationView.from(requireApplication(applicationId));
    }

    @Transactional(readOnly = true)
    public List<ApplicationView> list() {
        try {
            return applicationRepository.findAllByOrderByNameAsc().stream()
                    .map(ApplicationView::from)
                    .toList();
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public ApplicationView update(@NonNull UUID applicationId, String name, String title, String description) {
        String checkedName = Identifiers.applicationName(name);
        Identifiers.optionalText("title", title);
        Identifiers.optionalText("description", description);
        Application application = requireApplication(applicationId);
        try {
            applicationRepository.findByName(checkedName)
                    .filter(other -> !other.getId().equals(applicationId))
                    .ifPresent(other -> {
                        throw nameTaken(checkedName);
                    });
            application.setName(checkedName);
            application.setTitle(title);
            application.setDescription(description);
            return ApplicationView.from(applicationRepository.saveAndFlush(application));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    /**
     * Disabling an application makes every login into it fail and every permission in it resolve to
     * nothing. Data is kept.
     */
    public ApplicationView setEnabled(@NonNull UUID applicationId, boolean enabled) {
        Application application = requireApplication(applicationId);
        if (application.isEnabled() != enabled) {
            application.setEnabled(enabled);
            log.info("Application {} {}", application.getName(), enabled ? "enabled" : "disabled");
        }
        try {
            return ApplicationView.from(applicationRepository.saveAndFlush(application));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    /**
     * Deletes an empty application. Applications that still own users or roles are refused.
     */
    public void delete(@NonNull UUID applicationId) {
        Application application = requireApplication(applicationId);
        try {
            if (userRepository.countByApplicationId(applicationId) > 0
                    || roleRepository.countByApplicationId(applicationId) > 0) {
                throw new ConflictException("application.in_use",
                        "Application `" + application.getName() + "` still has users or roles.");
            }
            applicationRepository.delete(application);
            applicationRepository.flush();
            log.info("Deleted application {} ({})", application.getName(), applicationId);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public Application requireApplication(UUID applicationId) {
        try {
            return applicationRepository.findById(applicationId)
                    .orElseThrow(() -> new NotFoundException("application.not_found",
                            "Application " + applicationId + " does not exist."));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private static ConflictException nameTaken(String name) {
        return new ConflictException("application.name_taken", "The application name `" + name + "` is taken.");
    }
}
