package com.campusauth.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.RefreshToken;
import com.campusauth.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campusauth.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent side of the token lifecycle. Opaque refresh tokens are handed to clients once;
 * only their SHA-256 digest is stored.
 */
@Service
@Transactional(noRollbackFor = RefreshTokenException.class)
public class RefreshTokenStore {

    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_USER_DELETED = "USER_DELETED";

    private static final int TOKEN_BYTES = 64;
    private static final Base64.Encoder TOKEN_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final RefreshTokenRepository refreshTokenRepository;
    private final CampusUserRepository userRepository;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public RefreshTokenStore(
            RefreshTokenRepository refreshTokenRepository,
            CampusUserRepository userRepository,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    public IssuedRefreshToken create(UUID userId, Duration ttl) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        byte[] raw = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(raw);
        String token = TOKEN_ENCODER.encodeToString(raw);

        RefreshToken record = new RefreshToken();
        record.setUser(userRepository.getReferenceById(userId));
        record.setTokenHash(digest(token));
        record.setCreatedAt(now);
        record.setExpiresAt(now.plus(ttl));
        record.setRevoked(false);
        refreshTokenRepository.saveAndFlush(record);
        return new IssuedRefreshToken(token, record.getExpiresAt());
    }

    /**
     * Consumes {@code token} and issues its successor. The conditional update is the only
     * serialization point, so of two concurrent calls exactly one sees an updated row.
     */
    public RotationResult validateAndRotate(String token, Duration ttl) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String hash = digest(token);
        int updated = refreshTokenRepository.revokeIfActive(hash, now, REASON_ROTATED);
        if (updated == 0) {
            throw new RefreshTokenException(classify(hash));
        }
        RefreshToken consumed = refreshTokenRepository.findByTokenHash(hash)
                .orElseThrow(() -> new RefreshTokenException(RefreshTokenException.Failure.NOT_FOUND));
        UUID userId = consumed.getUser().getId();
        IssuedRefreshToken replacement = create(userId, ttl);
        return new RotationResult(userId, replacement);
    }

    public void revoke(String token) {
        int updated = refreshTokenRepository.revokeByTokenHash(digest(token), OffsetDateTime.now(clock), REASON_LOGOUT);
        if (updated == 0) {
            throw new RefreshTokenException(RefreshTokenException.Failure.NOT_FOUND);
        }
    }

    public void revoke(String token, UUID ownerId) {
        int updated = refreshTokenRepository.revokeByTokenHashAndUserId(
                digest(token), ownerId, OffsetDateTime.now(clock), REASON_LOGOUT);
        if (updated == 0) {
            throw new RefreshTokenException(RefreshTokenException.Failure.NOT_FOUND);
        }
    }

    public int revokeAllForUser(UUID userId) {
        return refreshTokenRepository.revokeAllByUserId(userId, OffsetDateTime.now(clock), REASON_USER_DELETED);
    }

    public int purgeStale(OffsetDateTime cutoff) {
        return refreshTokenRepository.deleteStale(cutoff);
    }

    private RefreshTokenException.Failure classify(String hash) {
        return refreshTokenRepository.findByTokenHash(hash)
                .map(record -> record.isRevoked()
                        ? RefreshTokenException.Failure.REVOKED
                        : RefreshTokenException.Failure.EXPIRED)
                .orElse(RefreshTokenException.Failure.NOT_FOUND);
    }

    static String digest(String token) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record IssuedRefreshToken(String token, OffsetDateTime expiresAt) {
    }

    public record RotationResult(UUID userId, IssuedRefreshToken refreshToken) {
    }
}
