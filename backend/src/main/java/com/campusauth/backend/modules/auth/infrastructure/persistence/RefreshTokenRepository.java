package com.campusauth.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /**
     * Revokes the record only while it is still active. Concurrent callers race on the row
     * lock; the loser re-evaluates the predicate after the winner commits and updates nothing.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason
             where rt.tokenHash = :tokenHash
               and rt.revoked = false
               and rt.expiresAt > :now
            """)
    int revokeIfActive(@Param("tokenHash") String tokenHash,
                       @Param("now") OffsetDateTime now,
                       @Param("reason") String reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = coalesce(rt.revokedAt, :now),
                   rt.revokedReason = coalesce(rt.revokedReason, :reason)
             where rt.tokenHash = :tokenHash
            """)
    int revokeByTokenHash(@Param("tokenHash") String tokenHash,
                          @Param("now") OffsetDateTime now,
                          @Param("reason") String reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = coalesce(rt.revokedAt, :now),
                   rt.revokedReason = coalesce(rt.revokedReason, :reason)
             where rt.tokenHash = :tokenHash
               and rt.user.id = :userId
            """)
    int revokeByTokenHashAndUserId(@Param("tokenHash") String tokenHash,
                                   @Param("userId") UUID userId,
                                   @Param("now") OffsetDateTime now,
                                   @Param("reason") String reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason
             where rt.user.id = :userId
               and rt.revoked = false
            """)
    int revokeAllByUserId(@Param("userId") UUID userId,
                          @Param("now") OffsetDateTime now,
                          @Param("reason") String reason);

    @Modifying
    @Query("""
            delete from RefreshToken rt
             where rt.expiresAt < :cutoff
                or (rt.revoked = true and rt.revokedAt < :cutoff)
            """)
    int deleteStale(@Param("cutoff") OffsetDateTime cutoff);

    long countByUserIdAndRevokedFalse(UUID userId);
}
