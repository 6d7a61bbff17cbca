package com.campusauth.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.campusauth.backend.global.error.ProblemException;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.infrastructure.persistence.CampusUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Checks a login/password pair. Unknown logins still pay for one hash comparison, and both
 * failure paths raise the same error.
 */
@Component
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    static final String INVALID_CREDENTIALS = "auth.invalid_credentials";

    private final CampusUserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final String dummyHash;

    public CredentialVerifier(
            CampusUserRepository userRepository,
            PasswordHasher passwordHasher,
            PasswordEncoder passwordEncoder
    ) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public CampusUser verify(String login, String password) {
        Optional<CampusUser> candidate = userRepository.findByLogin(login);
        String hash = candidate.map(CampusUser::getPasswordHash).orElse(dummyHash);
        boolean matches = passwordHasher.matches(password, hash);

        if (candidate.isEmpty()) {
            log.info("Login rejected: unknown login");
            throw invalidCredentials();
        }
        if (!matches) {
            log.info("Login rejected: password mismatch for userId={}", candidate.get().getId());
            throw invalidCredentials();
        }
        return candidate.get();
    }

    static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid login or password");
    }
}
