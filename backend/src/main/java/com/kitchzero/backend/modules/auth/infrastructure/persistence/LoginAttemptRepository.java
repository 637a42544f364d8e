package com.kitchzero.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.kitchzero.backend.modules.auth.domain.LoginAttempt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, UUID> {

    @Query("""
            select count(la)
              from LoginAttempt la
             where la.success = false
               and la.attemptedAt >= :since
               and (lower(la.username) = lower(:username) or la.clientAddress = :clientAddress)
            """)
    long countRecentFailures(@Param("username") String username,
                             @Param("clientAddress") String clientAddress,
                             @Param("since") OffsetDateTime since);

    @Modifying
    @Query("""
            delete from LoginAttempt la
             where la.success = false
               and (lower(la.username) = lower(:username) or la.clientAddress = :clientAddress)
            """)
    int deleteFailures(@Param("username") String username, @Param("clientAddress") String clientAddress);

    @Modifying
    @Query("delete from LoginAttempt la where la.attemptedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
