package com.campusauth.backend.modules.users.application;

import com.campusauth.backend.modules.auth.application.PasswordHasher;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Gender;
import com.campusauth.backend.modules.auth.domain.Role;
import com.campusauth.backend.modules.auth.infrastructure.persistence.CampusUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Seeds the bootstrap administrator on startup when no account with that login exists.
 */
@Component
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final CampusUserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final boolean enabled;
    private final String login;
    private final String password;

    public AdminAccountInitializer(
            CampusUserRepository userRepository,
            PasswordHasher passwordHasher,
            @Value("${app.bootstrap.admin.enabled:true}") boolean enabled,
            @Value("${app.bootstrap.admin.login:admin}") String login,
            @Value("${app.bootstrap.admin.password:admin}") String password
    ) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.enabled = enabled;
        this.login = login;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.debug("Admin bootstrap disabled");
            return;
        }
        if (!StringUtils.hasText(login) || !StringUtils.hasText(password)) {
            throw new IllegalStateException("app.bootstrap.admin.login and password must be set when bootstrap is enabled");
        }
        if (userRepository.existsByLogin(login)) {
            log.debug("Admin account '{}' already present", login);
            return;
        }

        CampusUser admin = new CampusUser();
        admin.setLastName("Admin");
        admin.setFirstName("Admin");
        admin.setLogin(login);
        admin.setPasswordHash(passwordHasher.hash(password));
        admin.setRole(Role.ADMIN);
        admin.setGender(Gender.MALE);
        try {
            userRepository.saveAndFlush(admin);
            log.info("Seeded admin account '{}'", login);
        } catch (DataIntegrityViolationException ex) {
            log.info("Admin account '{}' was created concurrently", login);
        }
    }
}
