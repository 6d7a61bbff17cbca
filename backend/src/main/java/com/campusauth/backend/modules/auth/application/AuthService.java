package com.campusauth.backend.modules.auth.application;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.campusauth.backend.global.error.ProblemException;
import com.campusauth.backend.modules.auth.application.JwtTokenService.AccessTokenClaims;
import com.campusauth.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.campusauth.backend.modules.auth.application.RefreshTokenStore.IssuedRefreshToken;
import com.campusauth.backend.modules.auth.application.RefreshTokenStore.RotationResult;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Permission;
import com.campusauth.backend.modules.auth.domain.RolePermissionTable;
import com.campusauth.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campusauth.backend.modules.auth.presentation.dto.LoginRequest;
import com.campusauth.backend.modules.auth.presentation.dto.LogoutRequest;
import com.campusauth.backend.modules.auth.presentation.dto.RefreshRequest;
import com.campusauth.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.campusauth.backend.modules.auth.presentation.dto.VerifyResponse;
import com.campusauth.backend.modules.users.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Token lifecycle entry point: login, refresh rotation, logout and access token verification.
 * <p>
 * Login does not open a transaction around credential checking, so a slow Argon2 comparison
 * never holds a database connection. Refresh runs in one transaction with the store.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_REFRESH_TOKEN = "auth.invalid_refresh_token";
    static final String INVALID_ACCESS_TOKEN = "auth.invalid_access_token";

    private final CredentialVerifier credentialVerifier;
    private final RefreshTokenStore refreshTokenStore;
    private final JwtTokenService jwtTokenService;
    private final RolePermissionTable rolePermissionTable;
    private final CampusUserRepository userRepository;

    public AuthService(
            CredentialVerifier credentialVerifier,
            RefreshTokenStore refreshTokenStore,
            JwtTokenService jwtTokenService,
            RolePermissionTable rolePermissionTable,
            CampusUserRepository userRepository
    ) {
        this.credentialVerifier = credentialVerifier;
        this.refreshTokenStore = refreshTokenStore;
        this.jwtTokenService = jwtTokenService;
        this.rolePermissionTable = rolePermissionTable;
        this.userRepository = userRepository;
    }

    public TokenPairResponse login(LoginRequest request) {
        CampusUser user = credentialVerifier.verify(request.login(), request.password());
        IssuedRefreshToken refreshToken;
        try {
            refreshToken = refreshTokenStore.create(user.getId(), refreshTtl());
        } catch (DataIntegrityViolationException ex) {
            log.info("Login rejected: reason=USER_MISSING userId={}", user.getId());
            throw CredentialVerifier.invalidCredentials();
        }
        log.info("Login succeeded for userId={} role={}", user.getId(), user.getRole().code());
        return issuePair(user, refreshToken);
    }

    @Transactional
    public TokenPairResponse refresh(RefreshRequest request) {
        RotationResult rotation;
        try {
            rotation = refreshTokenStore.validateAndRotate(request.refreshToken(), refreshTtl());
        } catch (RefreshTokenException ex) {
            log.info("Refresh rejected: reason={}", ex.getFailure());
            throw invalidRefreshToken();
        } catch (DataIntegrityViolationException ex) {
            log.info("Refresh rejected: reason=USER_MISSING");
            throw invalidRefreshToken();
        }
        CampusUser user = userRepository.findById(rotation.userId())
                .orElseThrow(() -> {
                    log.info("Refresh rejected: reason=USER_MISSING userId={}", rotation.userId());
                    return invalidRefreshToken();
                });
        return issuePair(user, rotation.refreshToken());
    }

    /**
     * Revokes the caller's own refresh token. Unknown, foreign and already revoked tokens
     * produce the same outcome.
     */
    public void logout(LogoutRequest request, UUID callerId) {
        try {
            refreshTokenStore.revoke(request.refreshToken(), callerId);
            log.info("Logout revoked a refresh token for userId={}", callerId);
        } catch (RefreshTokenException ex) {
            log.debug("Logout ignored token for userId={}: reason={}", callerId, ex.getFailure());
        }
    }

    public VerifyResponse verify(String accessToken) {
        AccessTokenClaims claims;
        try {
            claims = jwtTokenService.decode(accessToken);
        } catch (InvalidTokenException ex) {
            log.info("Access token rejected: reason={}", ex.getReason());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_ACCESS_TOKEN, "Invalid access token");
        }
        return new VerifyResponse(claims.userId(), claims.role(), sorted(claims.permissions()));
    }

    @Transactional(readOnly = true)
    public UserResponse loadCurrentUser(UUID userId) {
        return userRepository.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.user_missing", "User no longer exists"));
    }

    private TokenPairResponse issuePair(CampusUser user, IssuedRefreshToken refreshToken) {
        Set<Permission> permissions = rolePermissionTable.permissionsFor(user.getRole());
        String accessToken = jwtTokenService.issueAccessToken(user.getId(), user.getRole(), permissions);
        return new TokenPairResponse(
                accessToken,
                refreshToken.token(),
                jwtTokenService.getAccessTokenTtlMillis() / 1000L,
                TokenPairResponse.DEFAULT_TOKEN_TYPE
        );
    }

    private Duration refreshTtl() {
        return Duration.ofMillis(jwtTokenService.getRefreshTokenTtlMillis());
    }

    private static List<Permission> sorted(Set<Permission> permissions) {
        return permissions.stream().sorted().toList();
    }

    private static ProblemException invalidRefreshToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_REFRESH_TOKEN, "Invalid refresh token");
    }
}
