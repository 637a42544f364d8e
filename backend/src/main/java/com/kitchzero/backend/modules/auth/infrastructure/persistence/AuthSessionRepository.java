package com.kitchzero.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.kitchzero.backend.modules.auth.domain.AuthSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AuthSessionRepository extends JpaRepository<AuthSession, UUID> {

    /**
     * Compare-and-swap of the bound refresh token id. Returns 1 only for the caller whose
     * {@code expectedTokenId} still matches; concurrent callers holding the same id serialize on the row lock
     * and observe 0.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AuthSession s
               set s.currentRefreshTokenId = :nextTokenId,
                   s.lastActivityAt = :now,
                   s.updatedAt = :now
             where s.id = :sessionId
               and s.currentRefreshTokenId = :expectedTokenId
               and s.expiresAt > :now
            """)
    int compareAndSetRefreshTokenId(@Param("sessionId") UUID sessionId,
                                    @Param("expectedTokenId") String expectedTokenId,
                                    @Param("nextTokenId") String nextTokenId,
                                    @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying
    @Query("update AuthSession s set s.lastActivityAt = :now where s.id = :sessionId")
    int touch(@Param("sessionId") UUID sessionId, @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("delete from AuthSession s where s.id = :sessionId")
    int deleteSession(@Param("sessionId") UUID sessionId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("delete from AuthSession s where s.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    @Transactional
    @Modifying
    @Query("delete from AuthSession s where s.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);

    long countByUserId(UUID userId);
}
