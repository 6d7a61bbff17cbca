package com.campusauth.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.Permission;
import com.campusauth.backend.modules.auth.domain.Role;
import com.campusauth.backend.modules.auth.infrastructure.jwt.JwtKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Encodes and decodes signed access tokens. Holds no mutable state, so a single instance
 * serves all request threads.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TYPE = "type";
    static final String ACCESS_TOKEN_TYPE = "access";

    private final JwtKeyProvider keyProvider;
    private final JwtParser parser;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtKeyProvider keyProvider,
            @Value("${jwt.expiration:1800000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.keyProvider = keyProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
        this.parser = keyProvider.verifyWith(Jwts.parser())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issueAccessToken(UUID userId, Role role, Collection<Permission> permissions) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);
        List<String> permissionCodes = permissions.stream()
                .sorted()
                .map(Permission::code)
                .toList();

        return keyProvider.sign(Jwts.builder()
                        .id(UUID.randomUUID().toString())
                        .subject(userId.toString())
                        .issuedAt(Date.from(now))
                        .expiration(Date.from(expiry))
                        .claim(CLAIM_ROLE, role.code())
                        .claim(CLAIM_PERMISSIONS, permissionCodes)
                        .claim(CLAIM_TYPE, ACCESS_TOKEN_TYPE))
                .compact();
    }

    public AccessTokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Access token is empty", null);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "Access token expired", e);
        } catch (SecurityException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.INVALID_SIGNATURE, "Signature check failed", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Access token is malformed", e);
        }

        try {
            if (!ACCESS_TOKEN_TYPE.equals(claims.get(CLAIM_TYPE, String.class))) {
                throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Not an access token", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            Role role = Role.fromCode(claims.get(CLAIM_ROLE, String.class));
            List<?> permissionsClaim = claims.get(CLAIM_PERMISSIONS, List.class);
            Set<Permission> permissions = EnumSet.noneOf(Permission.class);
            if (permissionsClaim != null) {
                for (Object code : permissionsClaim) {
                    permissions.add(Permission.fromCode(String.valueOf(code)));
                }
            }
            if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Missing iat/exp", null);
            }
            return new AccessTokenClaims(
                    userId,
                    role,
                    Set.copyOf(permissions),
                    OffsetDateTime.ofInstant(claims.getIssuedAt().toInstant(), clock.getZone()),
                    OffsetDateTime.ofInstant(claims.getExpiration().toInstant(), clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Access token claims are invalid", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    public record AccessTokenClaims(
            UUID userId,
            Role role,
            Set<Permission> permissions,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {

        public enum Reason {
            EXPIRED,
            INVALID_SIGNATURE,
            MALFORMED
        }

        private final Reason reason;

        public InvalidTokenException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }
    }
}
