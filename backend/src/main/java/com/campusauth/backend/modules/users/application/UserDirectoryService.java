package com.campusauth.backend.modules.users.application;

import java.util.List;
import java.util.UUID;

import com.campusauth.backend.global.error.ProblemException;
import com.campusauth.backend.modules.auth.application.PasswordHasher;
import com.campusauth.backend.modules.auth.application.RefreshTokenStore;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campusauth.backend.modules.users.presentation.dto.CreateUserRequest;
import com.campusauth.backend.modules.users.presentation.dto.UpdateUserRequest;
import com.campusauth.backend.modules.users.presentation.dto.UserListResponse;
import com.campusauth.backend.modules.users.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Admin-facing user CRUD. Password hashing happens before the write transaction opens.
 */
@Service
public class UserDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(UserDirectoryService.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    static final String USER_NOT_FOUND = "users.not_found";
    static final String LOGIN_CONFLICT = "users.login_conflict";

    private final CampusUserRepository userRepository;
    private final RefreshTokenStore refreshTokenStore;
    private final PasswordHasher passwordHasher;
    private final TransactionTemplate transactionTemplate;

    public UserDirectoryService(
            CampusUserRepository userRepository,
            RefreshTokenStore refreshTokenStore,
            PasswordHasher passwordHasher,
            PlatformTransactionManager transactionManager
    ) {
        this.userRepository = userRepository;
        this.refreshTokenStore = refreshTokenStore;
        this.passwordHasher = passwordHasher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Transactional(readOnly = true)
    public UserListResponse list(Integer offset, Integer limit) {
        int effectiveOffset = normalizeOffset(offset);
        int effectiveLimit = normalizeLimit(limit);
        List<UserResponse> items = userRepository.findSlice(effectiveOffset, effectiveLimit).stream()
                .map(UserResponse::from)
                .toList();
        return new UserListResponse(items, userRepository.count(), effectiveOffset, effectiveLimit);
    }

    @Transactional(readOnly = true)
    public UserResponse get(UUID userId) {
        return UserResponse.from(findUser(userId));
    }

    public UserResponse create(CreateUserRequest request) {
        String passwordHash = passwordHasher.hash(request.password());
        return transactionTemplate.execute(status -> {
            if (userRepository.existsByLogin(request.login())) {
                throw loginConflict();
            }
            CampusUser user = new CampusUser();
            user.setLastName(request.lastName());
            user.setFirstName(request.firstName());
            user.setMiddleName(request.middleName());
            user.setLogin(request.login());
            user.setPasswordHash(passwordHash);
            user.setRole(request.role());
            user.setGender(request.gender());
            user.setClassName(request.className());
            user.setGraduationYear(request.graduationYear());
            CampusUser saved = saveUnique(user);
            log.info("Created userId={} role={}", saved.getId(), saved.getRole().code());
            return UserResponse.from(saved);
        });
    }

    public UserResponse update(UUID userId, UpdateUserRequest request) {
        String passwordHash = request.password() != null ? passwordHasher.hash(request.password()) : null;
        return transactionTemplate.execute(status -> {
            CampusUser user = findUser(userId);
            if (request.login() != null && !request.login().equals(user.getLogin())) {
                if (userRepository.existsByLoginAndIdNot(request.login(), userId)) {
                    throw loginConflict();
                }
                user.setLogin(request.login());
            }
            if (request.lastName() != null) {
                user.setLastName(request.lastName());
            }
            if (request.firstName() != null) {
                user.setFirstName(request.firstName());
            }
            if (request.middleName() != null) {
                user.setMiddleName(request.middleName());
            }
            if (request.role() != null) {
                user.setRole(request.role());
            }
            if (request.gender() != null) {
                user.setGender(request.gender());
            }
            if (request.className() != null) {
                user.setClassName(request.className());
            }
            if (request.graduationYear() != null) {
                user.setGraduationYear(request.graduationYear());
            }
            if (passwordHash != null) {
                user.setPasswordHash(passwordHash);
            }
            CampusUser saved = saveUnique(user);
            log.info("Updated userId={}", saved.getId());
            return UserResponse.from(saved);
        });
    }

    @Transactional
    public void delete(UUID userId) {
        CampusUser user = findUser(userId);
        int revoked = refreshTokenStore.revokeAllForUser(userId);
        userRepository.delete(user);
        userRepository.flush();
        log.info("Deleted userId={} (revoked {} refresh tokens)", userId, revoked);
    }

    static int normalizeOffset(Integer offset) {
        return offset == null || offset < 0 ? 0 : offset;
    }

    static int normalizeLimit(Integer limit) {
        if (limit == null || limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private CampusUser findUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, USER_NOT_FOUND, "User not found"));
    }

    private CampusUser saveUnique(CampusUser user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            log.info("Login conflict on write: {}", ex.getMostSpecificCause().getMessage());
            throw loginConflict();
        }
    }

    private static ProblemException loginConflict() {
        return new ProblemException(HttpStatus.CONFLICT, LOGIN_CONFLICT, "Login already exists");
    }
}
