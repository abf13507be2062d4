package com.secma.core.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.secma.core.global.error.ConflictException;
import com.secma.core.global.error.InvalidInputException;
import com.secma.core.global.error.NotFoundException;
import com.secma.core.global.error.StoreFailures;
import com.secma.core.global.validation.Identifiers;
import com.secma.core.modules.auth.domain.SecmaUser;
import com.secma.core.modules.auth.infrastructure.persistence.SecmaUserRepository;
import com.secma.core.modules.tenancy.application.ApplicationService;
import com.secma.core.modules.tenancy.domain.Application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User accounts of one application. Accounts are disabled instead of deleted.
 */
@Service
@Transactional
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    private final SecmaUserRepository userRepository;
    private final ApplicationService applicationService;
    private final PasswordHasher passwordHasher;
    private final SuperUserAccount superUserAccount;
    private final Clock clock;

    public UserAdminService(
            SecmaUserRepository userRepository,
            ApplicationService applicationService,
            PasswordHasher passwordHasher,
            SuperUserAccount superUserAccount,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.applicationService = applicationService;
        this.passwordHasher = passwordHasher;
        this.superUserAccount = superUserAccount;
        this.clock = clock;
    }

    public UserView create(@NonNull UUID applicationId, String login, String password) {
        String checkedLogin = checkLogin(login);
        String digest = passwordHasher.hash(checkPassword(password));
        Application application = applicationService.requireApplication(applicationId);
        try {
            if (userRepository.existsByApplicationIdAndLogin(applicationId, checkedLogin)) {
                throw loginTaken(checkedLogin);
            }
            SecmaUser user = new SecmaUser();
            user.setApplication(application);
            user.setLogin(checkedLogin);
            user.setPasswordHash(digest);
            SecmaUser saved = userRepository.saveAndFlush(user);
            log.info("Created user {} in application {}", saved.getId(), applicationId);
            return UserView.from(saved);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public UserView get(@NonNull UUID applicationId, @NonNull UUID userId) {
        return UserView.from(requireUser(applicationId, userId));
    }

    @Transactional(readOnly = true)
    public List<UserView> list(@NonNull UUID applicationId) {
        applicationService.requireApplication(applicationId);
        try {
            return userRepository.findAllInApplication(applicationId).stream()
                    .map(UserView::from)
                    .toList();
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public UserView rename(@NonNull UUID applicationId, @NonNull UUID userId, String login) {
        String checkedLogin = checkLogin(login);
        SecmaUser user = requireUser(applicationId, userId);
        if (checkedLogin.equals(user.getLogin())) {
            return UserView.from(user);
        }
        try {
            if (userRepository.existsByApplicationIdAndLogin(applicationId, checkedLogin)) {
                throw loginTaken(checkedLogin);
            }
            user.setLogin(checkedLogin);
            return UserView.from(userRepository.saveAndFlush(user));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    public void changePassword(@NonNull UUID applicationId, @NonNull UUID userId, String password) {
        String digest = passwordHasher.hash(checkPassword(password));
        SecmaUser user = requireUser(applicationId, userId);
        user.setPasswordHash(digest);
        save(user);
        log.info("Changed password of user {} in application {}", userId, applicationId);
    }

    /**
     * Disabled users can no longer log in, refresh or hold any permission. Their grants are kept
     * and apply again once the account is enabled.
     */
    public UserView disable(@NonNull UUID applicationId, @NonNull UUID userId) {
        SecmaUser user = requireUser(applicationId, userId);
        if (!user.isEnabled()) {
            return UserView.from(user);
        }
        user.setEnabled(false);
        user.setDisabledAt(OffsetDateTime.now(clock));
        log.info("Disabled user {} in application {}", userId, applicationId);
        return UserView.from(save(user));
    }

    public UserView enable(@NonNull UUID applicationId, @NonNull UUID userId) {
        SecmaUser user = requireUser(applicationId, userId);
        if (user.isEnabled()) {
            return UserView.from(user);
        }
        user.setEnabled(true);
        user.setDisabledAt(null);
        log.info("Enabled user {} in application {}", userId, applicationId);
        return UserView.from(save(user));
    }

    public SecmaUser requireUser(UUID applicationId, UUID userId) {
        applicationService.requireApplication(applicationId);
        try {
            return userRepository.findInApplication(applicationId, userId)
                    .orElseThrow(() -> new NotFoundException("user.not_found",
                            "User " + userId + " does not exist in application " + applicationId + "."));
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private SecmaUser save(SecmaUser user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataAccessException ex) {
            throw StoreFailures.translate(ex);
        }
    }

    private String checkLogin(String login) {
        String checked = Identifiers.login(login);
        if (checked.equals(superUserAccount.getLogin())) {
            throw new ConflictException("user.login_reserved", "The login `" + checked + "` is reserved.");
        }
        return checked;
    }

    private static String checkPassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidInputException("password", "The password must be non-empty.");
        }
        return password;
    }

    private static ConflictException loginTaken(String login) {
        return new ConflictException("user.login_taken", "The login `" + login + "` is taken.");
    }
}
